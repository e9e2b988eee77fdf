package org.springaicommunity.github.mirror;

import java.time.Instant;

/**
 * Summary of a publisher run.
 *
 * @param collection collection that was read
 * @param published messages handed to the broker
 * @param batches non-empty batches read
 * @param acked tags settled by an ack
 * @param nacked tags settled by a nack
 * @param maxOutstanding largest number of unconfirmed messages at any time
 * @param cancelled true if the run was cancelled before the store was exhausted
 * @param startedAt start of the run
 * @param finishedAt end of the run
 */
public record PublishResult(String collection, long published, int batches, long acked, long nacked,
		int maxOutstanding, boolean cancelled, Instant startedAt, Instant finishedAt) {

	/**
	 * Messages that were published but never confirmed.
	 */
	public long abandoned() {
		return published - acked - nacked;
	}

}
