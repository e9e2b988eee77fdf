package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Outcome of a cached retrieval: either the record, or the selector that matched
 * nothing locally or remotely.
 *
 * <p>
 * Not-found is an expected outcome for scoped lookups (the item may have been deleted
 * upstream), so it is returned as a value. Callers that require the entity use
 * {@link #orElseThrow()}.
 */
public final class RetrievalResult {

	private final String collection;

	private final Selector selector;

	private final @Nullable ObjectNode record;

	private RetrievalResult(String collection, Selector selector, @Nullable ObjectNode record) {
		this.collection = collection;
		this.selector = selector;
		this.record = record;
	}

	public static RetrievalResult found(String collection, Selector selector, ObjectNode record) {
		return new RetrievalResult(collection, selector, record);
	}

	public static RetrievalResult notFound(String collection, Selector selector) {
		return new RetrievalResult(collection, selector, null);
	}

	public boolean isFound() {
		return record != null;
	}

	public Optional<ObjectNode> record() {
		return Optional.ofNullable(record);
	}

	/**
	 * @return the record
	 * @throws NotFoundException naming the collection and selector if nothing was found
	 */
	public ObjectNode orElseThrow() {
		if (record == null) {
			throw new NotFoundException(collection, selector);
		}
		return record;
	}

	public String collection() {
		return collection;
	}

	public Selector selector() {
		return selector;
	}

	@Override
	public String toString() {
		return (isFound() ? "Found{" : "NotFound{") + collection + " " + selector + "}";
	}

}
