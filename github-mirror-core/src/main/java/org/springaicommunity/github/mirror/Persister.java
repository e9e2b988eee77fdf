package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Document store holding mirrored records, one named collection per entity kind.
 *
 * <p>
 * Records are append-only: there is no update or delete. Implementations must serialize
 * concurrent {@code find}/{@code store} calls; making a find-then-store sequence atomic
 * for a given selector is left to callers that need it.
 */
public interface Persister {

	/**
	 * Field that receives the store-assigned id of each stored document.
	 */
	String ID_FIELD = "_id";

	/**
	 * Find all records of a collection matching the selector, in store id order.
	 * @param collection collection name (e.g., "users", "commits")
	 * @param selector equality criteria on dot-delimited field paths
	 * @return matching records (copies), possibly empty
	 */
	List<ObjectNode> find(String collection, Selector selector);

	/**
	 * Store a new record. The assigned id is written to {@link #ID_FIELD} of the stored
	 * document; the passed record is not modified.
	 * @param collection collection name
	 * @param record the record to store
	 * @return the collection-unique id
	 */
	long store(String collection, ObjectNode record);

	/**
	 * Read up to {@code limit} records passing the filter whose id is greater than
	 * {@code afterId}, in ascending id order.
	 * @param collection collection name
	 * @param filter scan filter
	 * @param afterId exclusive lower id bound (0 for the beginning)
	 * @param limit maximum number of records
	 * @return the next records, empty when exhausted
	 */
	List<ObjectNode> scan(String collection, ScanFilter filter, long afterId, int limit);

	/**
	 * Count records of a collection matching the selector.
	 */
	default int count(String collection, Selector selector) {
		return find(collection, selector).size();
	}

}
