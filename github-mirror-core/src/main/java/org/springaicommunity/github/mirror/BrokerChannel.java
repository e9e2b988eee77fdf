package org.springaicommunity.github.mirror;

import java.util.function.Consumer;

/**
 * Confirm-mode publishing channel to a durable topic exchange.
 */
public interface BrokerChannel extends AutoCloseable {

	/**
	 * Publish a message.
	 * @param payload message body
	 * @param persistent whether the broker should persist the message
	 * @param routingKey topic routing key
	 * @return the delivery tag later referenced by a {@link ConfirmEvent}
	 * @throws BrokerException if the message cannot be handed to the broker
	 */
	long publish(byte[] payload, boolean persistent, String routingKey);

	/**
	 * Register the receiver of ack and nack events. Events may be delivered on any
	 * thread.
	 */
	void setConfirmHandler(Consumer<ConfirmEvent> handler);

	/**
	 * Close the channel and its connection. Unconfirmed messages are abandoned.
	 * @throws BrokerException if closing fails
	 */
	@Override
	void close();

}
