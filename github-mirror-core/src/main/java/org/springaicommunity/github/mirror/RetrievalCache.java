package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fetch-once cache in front of the GitHub API: a record is fetched remotely only if no
 * stored record matches its selector.
 *
 * <p>
 * As long as calls for the same selector are serialized and the {@link Persister} is
 * shared, every distinct selector causes at most one remote fetch per store lifetime.
 */
public class RetrievalCache {

	private static final Logger logger = LoggerFactory.getLogger(RetrievalCache.class);

	/**
	 * Field carrying the store-assigned id on records handed back to callers.
	 */
	public static final String EXT_REF_FIELD = "ext_ref_id";

	private final Persister persister;

	public RetrievalCache(Persister persister) {
		this.persister = persister;
	}

	/**
	 * Return the stored record matching {@code selector}, fetching and storing it first if
	 * there is none.
	 * @param collection collection name
	 * @param selector selector identifying one logical entity
	 * @param fetch remote lookup; an empty result means the entity does not exist
	 * @return the found record (with {@value #EXT_REF_FIELD} set), or not-found
	 */
	public RetrievalResult fetchSingle(String collection, Selector selector, Supplier<Optional<ObjectNode>> fetch) {
		List<ObjectNode> stored = persister.find(collection, selector);
		if (!stored.isEmpty()) {
			logger.debug("Already got {} {}", collection, selector);
			return RetrievalResult.found(collection, selector, withExtRef(stored.get(0)));
		}

		Optional<ObjectNode> fetched = fetch.get();
		if (fetched.isEmpty()) {
			logger.debug("Remote {} {} not found", collection, selector);
			return RetrievalResult.notFound(collection, selector);
		}

		return RetrievalResult.found(collection, selector, store(collection, fetched.get()));
	}

	/**
	 * Store a freshly fetched record and return the stored form.
	 */
	ObjectNode store(String collection, ObjectNode record) {
		long id = persister.store(collection, record);
		ObjectNode result = record.deepCopy();
		result.put(Persister.ID_FIELD, id);
		result.put(EXT_REF_FIELD, id);
		logger.info("New {} {}", collection, id);
		return result;
	}

	private static ObjectNode withExtRef(ObjectNode stored) {
		stored.set(EXT_REF_FIELD, stored.path(Persister.ID_FIELD).deepCopy());
		return stored;
	}

}
