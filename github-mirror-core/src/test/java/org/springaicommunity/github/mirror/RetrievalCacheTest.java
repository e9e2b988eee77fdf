package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RetrievalCache}.
 */
@DisplayName("RetrievalCache Tests")
class RetrievalCacheTest {

	private final ObjectMapper objectMapper = new ObjectMapper();

	private InMemoryPersister persister;

	private RetrievalCache cache;

	private AtomicInteger fetches;

	@BeforeEach
	void setUp() {
		persister = new InMemoryPersister();
		cache = new RetrievalCache(persister);
		fetches = new AtomicInteger();
	}

	private Supplier<Optional<ObjectNode>> remote(ObjectNode record) {
		return () -> {
			fetches.incrementAndGet();
			return Optional.of(record.deepCopy());
		};
	}

	private Supplier<Optional<ObjectNode>> missing() {
		return () -> {
			fetches.incrementAndGet();
			return Optional.empty();
		};
	}

	@Nested
	@DisplayName("Fetch-Once Tests")
	class FetchOnceTest {

		@Test
		@DisplayName("Second fetch should be served from the store")
		void secondFetchServedFromStore() {
			ObjectNode user = objectMapper.createObjectNode().put("login", "octocat").put("id", 583231);
			Selector selector = Selector.of("login", "octocat");

			RetrievalResult first = cache.fetchSingle("users", selector, remote(user));
			RetrievalResult second = cache.fetchSingle("users", selector, remote(user));

			assertThat(fetches).hasValue(1);
			assertThat(persister.count("users", Selector.empty())).isEqualTo(1);
			assertThat(second.orElseThrow()).isEqualTo(first.orElseThrow());
		}

		@Test
		@DisplayName("Returned record should carry the store id as external reference")
		void recordCarriesExternalReference() {
			ObjectNode user = objectMapper.createObjectNode().put("login", "octocat");

			ObjectNode result = cache.fetchSingle("users", Selector.of("login", "octocat"), remote(user))
				.orElseThrow();

			assertThat(result.path(RetrievalCache.EXT_REF_FIELD).asLong())
				.isEqualTo(result.path(Persister.ID_FIELD).asLong())
				.isPositive();
		}

		@Test
		@DisplayName("Should not fetch when a stored record already matches")
		void storedRecordShortCircuits() {
			persister.store("users", objectMapper.createObjectNode().put("login", "octocat"));

			RetrievalResult result = cache.fetchSingle("users", Selector.of("login", "octocat"), missing());

			assertThat(result.isFound()).isTrue();
			assertThat(fetches).hasValue(0);
		}

	}

	@Nested
	@DisplayName("Not Found Tests")
	class NotFoundTest {

		@Test
		@DisplayName("Empty fetch should yield not-found and store nothing")
		void emptyFetchYieldsNotFound() {
			RetrievalResult result = cache.fetchSingle("users", Selector.of("login", "ghost"), missing());

			assertThat(result.isFound()).isFalse();
			assertThat(result.record()).isEmpty();
			assertThat(persister.count("users", Selector.empty())).isZero();
		}

		@Test
		@DisplayName("orElseThrow should raise NotFoundException with collection and selector")
		void orElseThrowRaises() {
			Selector selector = Selector.of("login", "ghost");
			RetrievalResult result = cache.fetchSingle("users", selector, missing());

			assertThatThrownBy(result::orElseThrow).isInstanceOf(NotFoundException.class)
				.satisfies(e -> {
					NotFoundException notFound = (NotFoundException) e;
					assertThat(notFound.getCollection()).isEqualTo("users");
					assertThat(notFound.getSelector()).isEqualTo(selector);
				});
		}

		@Test
		@DisplayName("Not-found should not be cached")
		void notFoundIsNotCached() {
			Selector selector = Selector.of("login", "ghost");

			cache.fetchSingle("users", selector, missing());
			cache.fetchSingle("users", selector, missing());

			assertThat(fetches).hasValue(2);
		}

	}

}
