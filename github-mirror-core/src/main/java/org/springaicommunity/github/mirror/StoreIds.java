package org.springaicommunity.github.mirror;

import java.time.Instant;

/**
 * Store-assigned record identifiers.
 *
 * <p>
 * An id carries the epoch second at which it was assigned in its upper bits and a
 * sequence number in its lower {@value #SEQUENCE_BITS} bits, so ids sort in insertion
 * order and a point in time maps to an id floor.
 */
public final class StoreIds {

	static final int SEQUENCE_BITS = 22;

	private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

	/**
	 * Largest epoch second an id can encode.
	 */
	public static final long MAX_EPOCH_SECOND = Long.MAX_VALUE >>> SEQUENCE_BITS;

	private StoreIds() {
	}

	/**
	 * The smallest id that can be assigned at or after the given instant. Instants past
	 * {@link #MAX_EPOCH_SECOND} map to {@link Long#MAX_VALUE}, which no id reaches.
	 * @param instant lower time bound
	 * @return id floor for {@link ScanFilter#withIdFloor(long)}
	 */
	public static long floorOf(Instant instant) {
		long epochSecond = instant.getEpochSecond();
		if (epochSecond > MAX_EPOCH_SECOND) {
			return Long.MAX_VALUE;
		}
		return Math.max(0, epochSecond) << SEQUENCE_BITS;
	}

	/**
	 * The epoch second encoded in an id.
	 */
	public static Instant timestampOf(long id) {
		return Instant.ofEpochSecond(id >>> SEQUENCE_BITS);
	}

	/**
	 * Next id after {@code previous} for an assignment happening at {@code now}. Strictly
	 * greater than {@code previous} even if the clock moved backwards.
	 * @param previous last id handed out, or 0
	 * @param now assignment time
	 * @return the next id
	 */
	public static long next(long previous, Instant now) {
		long candidate = floorOf(now);
		if (candidate > previous) {
			return candidate;
		}
		return previous + 1;
	}

	static long sequenceOf(long id) {
		return id & SEQUENCE_MASK;
	}

}
