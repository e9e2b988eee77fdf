package org.springaicommunity.github.mirror;

/**
 * Thrown when a {@link Persister} cannot read or write its backing storage.
 */
public class PersisterException extends RuntimeException {

	public PersisterException(String message, Throwable cause) {
		super(message, cause);
	}

}
