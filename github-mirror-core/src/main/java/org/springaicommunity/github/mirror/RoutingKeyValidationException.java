package org.springaicommunity.github.mirror;

/**
 * Thrown when the value a routing key is built from is not a non-empty string. Aborts the
 * publisher run.
 */
public class RoutingKeyValidationException extends RuntimeException {

	private final long recordId;

	public RoutingKeyValidationException(String collection, long recordId, String keyPath, String actual) {
		super("Record " + recordId + " of " + collection + ": routing key field '" + keyPath
				+ "' must be a non-empty string, got " + actual);
		this.recordId = recordId;
	}

	public long getRecordId() {
		return recordId;
	}

}
