package org.springaicommunity.github.mirror;

/**
 * Thrown when the message broker cannot be reached, published to, or closed.
 */
public class BrokerException extends RuntimeException {

	public BrokerException(String message) {
		super(message);
	}

	public BrokerException(String message, Throwable cause) {
		super(message, cause);
	}

}
