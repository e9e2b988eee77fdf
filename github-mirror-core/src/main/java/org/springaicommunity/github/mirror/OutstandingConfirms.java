package org.springaicommunity.github.mirror;

import java.util.NavigableSet;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Delivery tags published but not yet acked or nacked.
 *
 * <p>
 * Not thread-safe: owned by the thread running the publisher. A nack settles a tag
 * exactly like an ack; nacked tags are only counted.
 */
final class OutstandingConfirms {

	private final NavigableSet<Long> tags = new TreeSet<>();

	private long acked;

	private long nacked;

	private int highWaterMark;

	void add(long tag) {
		tags.add(tag);
		highWaterMark = Math.max(highWaterMark, tags.size());
	}

	/**
	 * Remove the tag of the event, or every tag up to and including it for a cumulative
	 * event.
	 * @return number of tags settled
	 */
	int settle(ConfirmEvent event) {
		int settled;
		if (event.multiple()) {
			SortedSet<Long> covered = tags.headSet(event.deliveryTag(), true);
			settled = covered.size();
			covered.clear();
		}
		else {
			settled = tags.remove(event.deliveryTag()) ? 1 : 0;
		}
		if (event.ack()) {
			acked += settled;
		}
		else {
			nacked += settled;
		}
		return settled;
	}

	boolean isEmpty() {
		return tags.isEmpty();
	}

	int size() {
		return tags.size();
	}

	SortedSet<Long> tags() {
		return new TreeSet<>(tags);
	}

	long acked() {
		return acked;
	}

	long nacked() {
		return nacked;
	}

	int highWaterMark() {
		return highWaterMark;
	}

}
