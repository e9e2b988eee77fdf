package org.springaicommunity.github.mirror;

/**
 * Publisher confirm delivered by the broker.
 *
 * @param deliveryTag tag of the confirmed publish
 * @param multiple true if every tag up to and including {@code deliveryTag} is confirmed
 * @param ack true for an ack, false for a nack
 */
public record ConfirmEvent(long deliveryTag, boolean multiple, boolean ack) {

	public static ConfirmEvent ack(long deliveryTag, boolean multiple) {
		return new ConfirmEvent(deliveryTag, multiple, true);
	}

	public static ConfirmEvent nack(long deliveryTag, boolean multiple) {
		return new ConfirmEvent(deliveryTag, multiple, false);
	}

}
