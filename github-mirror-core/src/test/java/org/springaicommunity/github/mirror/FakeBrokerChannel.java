package org.springaicommunity.github.mirror;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongPredicate;

/**
 * In-memory {@link BrokerChannel} for tests. Confirms are sent from a background thread
 * after a short delay, or never.
 */
class FakeBrokerChannel implements BrokerChannel {

	record Message(long tag, String body, boolean persistent, String routingKey) {
	}

	enum ConfirmMode {

		/** one confirm per message, in publish order */
		SINGLE,
		/** one cumulative confirm for the highest pending tag */
		CUMULATIVE,
		/** one confirm per pending message, highest tag first */
		REVERSE,
		/** no confirms at all */
		NONE

	}

	private final ScheduledExecutorService confirmer = Executors.newSingleThreadScheduledExecutor();

	private final List<Message> messages = Collections.synchronizedList(new ArrayList<>());

	private final ConfirmMode mode;

	private final List<Long> pending = new ArrayList<>();

	private LongPredicate nackWhen = tag -> false;

	private volatile Consumer<ConfirmEvent> handler = event -> {
	};

	private long nextTag = 1;

	private int unconfirmed;

	private int maxUnconfirmed;

	private volatile boolean closed;

	private FakeBrokerChannel(ConfirmMode mode) {
		this.mode = mode;
	}

	static FakeBrokerChannel confirming() {
		return new FakeBrokerChannel(ConfirmMode.SINGLE);
	}

	/**
	 * Confirms whatever is pending a few milliseconds after the last publish.
	 */
	static FakeBrokerChannel confirmingPending(ConfirmMode mode) {
		return new FakeBrokerChannel(mode);
	}

	static FakeBrokerChannel silent() {
		return new FakeBrokerChannel(ConfirmMode.NONE);
	}

	FakeBrokerChannel nackWhen(LongPredicate nackWhen) {
		this.nackWhen = nackWhen;
		return this;
	}

	@Override
	public synchronized long publish(byte[] payload, boolean persistent, String routingKey) {
		if (closed) {
			throw new BrokerException("Channel closed");
		}
		long tag = nextTag++;
		messages.add(new Message(tag, new String(payload, StandardCharsets.UTF_8), persistent,
				routingKey));
		unconfirmed++;
		maxUnconfirmed = Math.max(maxUnconfirmed, unconfirmed);
		if (mode == ConfirmMode.SINGLE) {
			confirmer.schedule(() -> sendConfirm(tag), 2, TimeUnit.MILLISECONDS);
		}
		else if (mode != ConfirmMode.NONE) {
			pending.add(tag);
			confirmer.schedule(this::confirmPending, 5, TimeUnit.MILLISECONDS);
		}
		return tag;
	}

	private void sendConfirm(long tag) {
		synchronized (this) {
			unconfirmed--;
		}
		handler.accept(nackWhen.test(tag) ? ConfirmEvent.nack(tag, false) : ConfirmEvent.ack(tag, false));
	}

	private void confirmPending() {
		List<Long> tags;
		synchronized (this) {
			if (pending.isEmpty()) {
				return;
			}
			tags = new ArrayList<>(pending);
			pending.clear();
			unconfirmed -= tags.size();
		}
		if (mode == ConfirmMode.CUMULATIVE) {
			handler.accept(ConfirmEvent.ack(tags.get(tags.size() - 1), true));
			return;
		}
		Collections.reverse(tags);
		for (long tag : tags) {
			handler.accept(nackWhen.test(tag) ? ConfirmEvent.nack(tag, false) : ConfirmEvent.ack(tag, false));
		}
	}

	@Override
	public void setConfirmHandler(Consumer<ConfirmEvent> handler) {
		this.handler = handler;
	}

	@Override
	public void close() {
		closed = true;
		confirmer.shutdownNow();
	}

	List<Message> messages() {
		synchronized (messages) {
			return new ArrayList<>(messages);
		}
	}

	synchronized int unconfirmed() {
		return unconfirmed;
	}

	synchronized int maxUnconfirmed() {
		return maxUnconfirmed;
	}

	boolean isClosed() {
		return closed;
	}

}
