package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CollectionSync}.
 *
 * Tests append-only merging, discriminator de-duplication and scoped lookups.
 */
@DisplayName("CollectionSync Tests")
class CollectionSyncTest {

	private static final Selector SCOPE = Selector.of("owner", "o").and("repo", "r");

	private final ObjectMapper objectMapper = new ObjectMapper();

	private InMemoryPersister persister;

	private CollectionSync sync;

	@BeforeEach
	void setUp() {
		persister = new InMemoryPersister();
		sync = new CollectionSync(persister);
	}

	private List<ObjectNode> watchers(String... logins) {
		List<ObjectNode> items = new ArrayList<>();
		for (String login : logins) {
			items.add(objectMapper.createObjectNode().put("login", login));
		}
		return items;
	}

	private List<ObjectNode> pulls(int... numbers) {
		List<ObjectNode> items = new ArrayList<>();
		for (int number : numbers) {
			items.add(objectMapper.createObjectNode().put("number", number).put("title", "PR " + number));
		}
		return items;
	}

	@Nested
	@DisplayName("Sync Tests")
	class SyncTest {

		@Test
		@DisplayName("Should store every remote item with the scope attached")
		void shouldStoreWithScope() {
			List<ObjectNode> result = sync.syncScopedCollection("watchers", SCOPE, List.of(watchers("a", "b")),
					"login");

			assertThat(result).hasSize(2);
			assertThat(result).allSatisfy(item -> {
				assertThat(item.path("owner").asText()).isEqualTo("o");
				assertThat(item.path("repo").asText()).isEqualTo("r");
			});
		}

		@Test
		@DisplayName("Items removed upstream should stay in the store")
		void appendOnly() {
			sync.syncScopedCollection("watchers", SCOPE, List.of(watchers("a", "b")), "login");

			List<ObjectNode> result = sync.syncScopedCollection("watchers", SCOPE, List.of(watchers("b")), "login");

			assertThat(result).extracting(n -> n.path("login").asText()).containsExactlyInAnyOrder("a", "b");
		}

		@Test
		@DisplayName("Repeated syncs should not duplicate items")
		void noDuplicatesOnRerun() {
			sync.syncScopedCollection("watchers", SCOPE, List.of(watchers("a", "b")), "login");
			sync.syncScopedCollection("watchers", SCOPE, List.of(watchers("a", "b", "c")), "login");

			assertThat(persister.count("watchers", SCOPE)).isEqualTo(3);
		}

		@Test
		@DisplayName("Items listed twice in one sync should be stored once")
		void duplicatesAcrossListings() {
			sync.syncScopedCollection("pull_requests", SCOPE, List.of(pulls(1, 2), pulls(2, 3)), "number");

			assertThat(persister.count("pull_requests", SCOPE)).isEqualTo(3);
		}

		@Test
		@DisplayName("Scopes should be independent")
		void scopesIndependent() {
			Selector other = Selector.of("owner", "o").and("repo", "other");
			sync.syncScopedCollection("watchers", SCOPE, List.of(watchers("a")), "login");

			List<ObjectNode> result = sync.syncScopedCollection("watchers", other, List.of(watchers("a")), "login");

			assertThat(result).hasSize(1);
			assertThat(persister.count("watchers", Selector.empty())).isEqualTo(2);
		}

		@Test
		@DisplayName("Items without the discriminator should be skipped")
		void missingDiscriminatorSkipped() {
			List<ObjectNode> items = watchers("a");
			items.add(objectMapper.createObjectNode().put("id", 5));

			List<ObjectNode> result = sync.syncScopedCollection("watchers", SCOPE, List.of(items), "login");

			assertThat(result).hasSize(1);
		}

	}

	@Nested
	@DisplayName("Scoped Item Tests")
	class ScopedItemTest {

		@Test
		@DisplayName("Stored item should be returned without listing")
		void storedItemWithoutListing() {
			sync.syncScopedCollection("pull_requests", SCOPE, List.of(pulls(7)), "number");
			Iterable<ObjectNode> failing = () -> {
				throw new AssertionError("listing must not be consumed");
			};

			RetrievalResult result = sync.fetchScopedItem("pull_requests", SCOPE, "number", IntNode.valueOf(7),
					List.of(failing));

			assertThat(result.orElseThrow().path("title").asText()).isEqualTo("PR 7");
		}

		@Test
		@DisplayName("Missing item should be synced from the listings")
		void missingItemSynced() {
			RetrievalResult result = sync.fetchScopedItem("pull_requests", SCOPE, "number", IntNode.valueOf(2),
					List.of(pulls(1, 2, 3)));

			assertThat(result.isFound()).isTrue();
			assertThat(persister.count("pull_requests", SCOPE)).isEqualTo(3);
		}

		@Test
		@DisplayName("Item absent upstream should be not-found")
		void absentUpstream() {
			RetrievalResult result = sync.fetchScopedItem("pull_requests", SCOPE, "number", IntNode.valueOf(9),
					List.of(pulls(1, 2)));

			assertThat(result.isFound()).isFalse();
			assertThatThrownBy(result::orElseThrow).isInstanceOf(NotFoundException.class);
		}

	}

}
