package org.springaicommunity.github.mirror;

/**
 * States of a {@link BackpressurePublisher} run.
 */
public enum PublisherState {

	IDLE, READING, PUBLISHING, AWAITING_ACKS, DRAINING, TERMINATED

}
