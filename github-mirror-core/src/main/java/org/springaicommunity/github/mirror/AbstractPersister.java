package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Base {@link Persister} keeping each collection as an id-ordered list in memory.
 *
 * <p>
 * All operations synchronize on the instance. Subclasses supply the initial contents of a
 * collection and are told about every stored document.
 */
public abstract class AbstractPersister implements Persister {

	private final Clock clock;

	private final Map<String, List<ObjectNode>> collections = new HashMap<>();

	private long lastId;

	protected AbstractPersister(Clock clock) {
		this.clock = clock;
	}

	/**
	 * Load the documents of a collection the first time it is accessed.
	 * @param collection collection name
	 * @return stored documents in ascending id order
	 */
	protected abstract List<ObjectNode> load(String collection);

	/**
	 * Called once a document was assigned its id, before it becomes visible to queries.
	 */
	protected abstract void stored(String collection, ObjectNode document);

	@Override
	public synchronized List<ObjectNode> find(String collection, Selector selector) {
		List<ObjectNode> result = new ArrayList<>();
		for (ObjectNode document : documents(collection)) {
			if (selector.matches(document)) {
				result.add(document.deepCopy());
			}
		}
		return result;
	}

	@Override
	public synchronized long store(String collection, ObjectNode record) {
		List<ObjectNode> documents = documents(collection);
		long id = StoreIds.next(lastId, clock.instant());
		ObjectNode document = record.deepCopy();
		document.put(ID_FIELD, id);
		stored(collection, document);
		documents.add(document);
		lastId = id;
		return id;
	}

	@Override
	public synchronized List<ObjectNode> scan(String collection, ScanFilter filter, long afterId, int limit) {
		List<ObjectNode> result = new ArrayList<>();
		for (ObjectNode document : documents(collection)) {
			if (result.size() >= limit) {
				break;
			}
			if (document.path(ID_FIELD).asLong() > afterId && filter.matches(document)) {
				result.add(document.deepCopy());
			}
		}
		return result;
	}

	private List<ObjectNode> documents(String collection) {
		return collections.computeIfAbsent(collection, name -> {
			List<ObjectNode> loaded = new ArrayList<>(load(name));
			for (ObjectNode document : loaded) {
				lastId = Math.max(lastId, document.path(ID_FIELD).asLong());
			}
			return loaded;
		});
	}

}
