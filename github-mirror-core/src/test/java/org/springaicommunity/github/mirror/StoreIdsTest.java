package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StoreIds Tests")
class StoreIdsTest {

	private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

	@Test
	@DisplayName("Ids in the same second should get increasing sequence numbers")
	void sameSecondIncrementsSequence() {
		long first = StoreIds.next(0, NOW);
		long second = StoreIds.next(first, NOW);

		assertThat(second).isEqualTo(first + 1);
		assertThat(StoreIds.sequenceOf(second)).isEqualTo(1);
		assertThat(StoreIds.timestampOf(second)).isEqualTo(NOW);
	}

	@Test
	@DisplayName("Ids should keep increasing when the clock moves backwards")
	void clockMovingBackwards() {
		long first = StoreIds.next(0, NOW);

		long second = StoreIds.next(first, NOW.minusSeconds(30));

		assertThat(second).isGreaterThan(first);
	}

	@Test
	@DisplayName("Floor of an instant should sort between earlier and later ids")
	void floorSortsBetweenIds() {
		long before = StoreIds.next(0, NOW.minusSeconds(1));
		long at = StoreIds.next(before, NOW);

		long floor = StoreIds.floorOf(NOW);

		assertThat(before).isLessThan(floor);
		assertThat(at).isGreaterThanOrEqualTo(floor);
	}

	@Test
	@DisplayName("Floor of an instant before the epoch should be zero")
	void floorBeforeEpoch() {
		assertThat(StoreIds.floorOf(Instant.ofEpochSecond(-5))).isZero();
	}

	@Test
	@DisplayName("Floor past the encodable range should not wrap around")
	void floorPastRangeDoesNotWrap() {
		long lastFloor = StoreIds.floorOf(Instant.ofEpochSecond(StoreIds.MAX_EPOCH_SECOND));

		long beyond = StoreIds.floorOf(Instant.ofEpochSecond(StoreIds.MAX_EPOCH_SECOND + 1));

		assertThat(lastFloor).isPositive();
		assertThat(beyond).isEqualTo(Long.MAX_VALUE);
	}

	@Test
	@DisplayName("Records should not pass a filter whose floor lies past the encodable range")
	void farFutureFloorExcludesRecords() {
		InMemoryPersister persister = new InMemoryPersister();
		persister.store("users", JsonNodeFactory.instance.objectNode().put("login", "octocat"));

		ScanFilter filter = ScanFilter.all()
			.withIdFloor(StoreIds.floorOf(Instant.ofEpochSecond(StoreIds.MAX_EPOCH_SECOND + 1)));

		assertThat(persister.scan("users", filter, 0, 10)).isEmpty();
	}

}
