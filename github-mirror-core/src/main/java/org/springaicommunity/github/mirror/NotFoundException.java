package org.springaicommunity.github.mirror;

/**
 * Thrown when a directly requested entity is neither stored nor available remotely.
 */
public class NotFoundException extends RuntimeException {

	private final String collection;

	private final Selector selector;

	public NotFoundException(String collection, Selector selector) {
		super("Cannot find " + collection + " matching " + selector);
		this.collection = collection;
		this.selector = selector;
	}

	public String getCollection() {
		return collection;
	}

	public Selector getSelector() {
		return selector;
	}

}
