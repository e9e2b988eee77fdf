package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges remote listings that belong to a parent scope (a repository, a user, an
 * organization) into the store.
 *
 * <p>
 * Sync is append-only and one-directional: items missing from the stored scope are
 * added, stored items are never updated, and items that disappeared upstream stay in the
 * store.
 */
public class CollectionSync {

	private static final Logger logger = LoggerFactory.getLogger(CollectionSync.class);

	private final Persister persister;

	public CollectionSync(Persister persister) {
		this.persister = persister;
	}

	/**
	 * Add every remote item of the scope that is not stored yet.
	 * @param collection collection name
	 * @param scope parent keys; each entry is written into every remote item before it
	 * is stored
	 * @param listings remote listings for the scope, concatenated in order
	 * @param discriminator field identifying an item within the scope
	 * @return all records stored under the scope after the merge
	 */
	public List<ObjectNode> syncScopedCollection(String collection, Selector scope,
			List<? extends Iterable<ObjectNode>> listings, String discriminator) {
		Set<String> present = new HashSet<>();
		for (ObjectNode stored : persister.find(collection, scope)) {
			discriminatorKey(stored, discriminator).ifPresent(present::add);
		}

		int added = 0;
		int existing = 0;
		for (Iterable<ObjectNode> listing : listings) {
			for (ObjectNode item : listing) {
				attachScope(item, scope);
				Optional<String> key = discriminatorKey(item, discriminator);
				if (key.isEmpty()) {
					logger.warn("{} {}: item without '{}', skipped", collection, scope, discriminator);
					continue;
				}
				if (present.add(key.get())) {
					persister.store(collection, item);
					added++;
					logger.info("Added {} {} -> {}", collection, scope, JsonPaths.read(item, discriminator).asText());
				}
				else {
					existing++;
					logger.debug("{} {} -> {} exists", collection, scope, JsonPaths.read(item, discriminator).asText());
				}
			}
		}
		logger.debug("Synced {} {}: {} added, {} existing", collection, scope, added, existing);

		return persister.find(collection, scope);
	}

	/**
	 * Return the stored item of the scope whose discriminator equals {@code value},
	 * syncing the whole scope first if it is not stored.
	 * @return the item, or not-found if it is not listed remotely either
	 */
	public RetrievalResult fetchScopedItem(String collection, Selector scope, String discriminator, JsonNode value,
			List<? extends Iterable<ObjectNode>> listings) {
		Selector selector = scope.and(discriminator, value);
		List<ObjectNode> stored = persister.find(collection, selector);
		if (!stored.isEmpty()) {
			logger.debug("Already got {} {}", collection, selector);
			return RetrievalResult.found(collection, selector, stored.get(0));
		}

		List<ObjectNode> synced = syncScopedCollection(collection, scope, listings, discriminator);
		for (ObjectNode item : synced) {
			if (selector.matches(item)) {
				return RetrievalResult.found(collection, selector, item);
			}
		}
		logger.debug("{} {} not listed upstream", collection, selector);
		return RetrievalResult.notFound(collection, selector);
	}

	private static void attachScope(ObjectNode item, Selector scope) {
		for (Map.Entry<String, JsonNode> entry : scope.criteria().entrySet()) {
			JsonPaths.write(item, entry.getKey(), entry.getValue().deepCopy());
		}
	}

	/**
	 * Normalized membership key; numbers compare by value.
	 */
	private static Optional<String> discriminatorKey(JsonNode record, String discriminator) {
		JsonNode value = JsonPaths.read(record, discriminator);
		if (value.isMissingNode() || value.isNull()) {
			return Optional.empty();
		}
		if (value.isNumber()) {
			return Optional.of("n:" + value.decimalValue().stripTrailingZeros().toPlainString());
		}
		return Optional.of(value.getNodeType() + ":" + value);
	}

}
