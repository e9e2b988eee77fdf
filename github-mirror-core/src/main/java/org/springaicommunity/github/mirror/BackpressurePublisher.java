package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Drains one stored collection into the broker, one batch at a time.
 *
 * <p>
 * A batch of at most {@code batchSize} records is read and published, then the run waits
 * until the broker has confirmed every message of the batch before it reads the next one.
 * At most one batch is therefore unconfirmed at any time. The run ends when a read returns
 * no records, or immediately when {@link #cancel()} is called; unconfirmed messages are
 * abandoned in that case.
 *
 * <p>
 * Confirms arrive on broker threads and are queued; only the thread executing
 * {@link #run()} touches the outstanding tags. Batches are read by store id after the last
 * record read, so records inserted during the run are neither skipped nor repeated.
 */
public class BackpressurePublisher {

	private static final Logger logger = LoggerFactory.getLogger(BackpressurePublisher.class);

	public static final int DEFAULT_BATCH_SIZE = 1000;

	private static final ConfirmEvent WAKE_UP = ConfirmEvent.ack(-1, false);

	private final Persister persister;

	private final BrokerChannel channel;

	private final ObjectMapper objectMapper;

	private final CollectionRoute route;

	private final ScanFilter filter;

	private final int batchSize;

	private final long confirmPollMs;

	private final BlockingQueue<ConfirmEvent> confirms = new LinkedBlockingQueue<>();

	private final OutstandingConfirms outstanding = new OutstandingConfirms();

	private volatile PublisherState state = PublisherState.IDLE;

	private volatile boolean cancelled;

	private long cursor;

	private long published;

	private int batches;

	public BackpressurePublisher(Persister persister, BrokerChannel channel, ObjectMapper objectMapper,
			CollectionRoute route, ScanFilter filter, int batchSize, long confirmPollMs) {
		if (batchSize <= 0) {
			throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
		}
		this.persister = persister;
		this.channel = channel;
		this.objectMapper = objectMapper;
		this.route = route;
		this.filter = filter;
		this.batchSize = batchSize;
		this.confirmPollMs = confirmPollMs;
	}

	/**
	 * Publish every matching record, then close the broker channel.
	 * @return summary of the run
	 * @throws RoutingKeyValidationException if a record has no usable routing key value
	 * @throws BrokerException if publishing or closing fails
	 * @throws IllegalStateException if this publisher has already run
	 */
	public PublishResult run() {
		if (state != PublisherState.IDLE) {
			throw new IllegalStateException("Publisher already ran (state " + state + ")");
		}
		Instant startedAt = Instant.now();
		logger.info("Loading {} matching {}", route.collection(), filter);
		channel.setConfirmHandler(confirms::offer);

		RuntimeException failure = null;
		try {
			while (!cancelled) {
				List<ObjectNode> batch = readBatch();
				if (batch.isEmpty()) {
					logger.info("Finished reading, exiting");
					break;
				}
				publishBatch(batch);
				awaitConfirms();
			}
		}
		catch (RuntimeException e) {
			failure = e;
			throw e;
		}
		finally {
			terminate(failure);
		}

		PublishResult result = new PublishResult(route.collection(), published, batches, outstanding.acked(),
				outstanding.nacked(), outstanding.highWaterMark(), cancelled, startedAt, Instant.now());
		if (result.abandoned() > 0) {
			logger.warn("Abandoned {} unconfirmed messages", result.abandoned());
		}
		logger.info("Published {} {} in {} batches ({} acked, {} nacked)", result.published(), route.collection(),
				result.batches(), result.acked(), result.nacked());
		return result;
	}

	/**
	 * Stop the run as soon as possible, without waiting for outstanding confirms. Safe to
	 * call from any thread, e.g. a shutdown hook.
	 */
	public void cancel() {
		if (!cancelled) {
			logger.info("Cancellation requested in state {}", state);
		}
		cancelled = true;
		confirms.offer(WAKE_UP);
	}

	public PublisherState state() {
		return state;
	}

	private List<ObjectNode> readBatch() {
		state = PublisherState.READING;
		List<ObjectNode> batch = persister.scan(route.collection(), filter, cursor, batchSize);
		if (!batch.isEmpty()) {
			cursor = batch.get(batch.size() - 1).path(Persister.ID_FIELD).asLong();
			batches++;
			logger.debug("Read batch {} with {} records, cursor now {}", batches, batch.size(), cursor);
		}
		return batch;
	}

	private void publishBatch(List<ObjectNode> batch) {
		state = PublisherState.PUBLISHING;
		for (ObjectNode record : batch) {
			if (cancelled) {
				return;
			}
			String keyValue = routingValue(record);
			long tag = channel.publish(payload(record), true, route.routingKey(keyValue));
			outstanding.add(tag);
			published++;
			logger.debug("Publish id = {} ({} total)", keyValue, published);
		}
	}

	private void awaitConfirms() {
		state = PublisherState.AWAITING_ACKS;
		while (!outstanding.isEmpty() && !cancelled) {
			ConfirmEvent event;
			try {
				event = confirms.poll(confirmPollMs, TimeUnit.MILLISECONDS);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				cancelled = true;
				return;
			}
			if (event == null || event == WAKE_UP) {
				continue;
			}
			if (event.ack()) {
				logger.debug("ACK: tag={}, mul={}", event.deliveryTag(), event.multiple());
			}
			else {
				logger.warn("NACK: tag={}, mul={}; treated as settled", event.deliveryTag(), event.multiple());
			}
			outstanding.settle(event);
		}
		if (outstanding.isEmpty()) {
			logger.debug("All confirms received for batch {}", batches);
		}
	}

	private void terminate(@Nullable RuntimeException failure) {
		state = PublisherState.DRAINING;
		try {
			channel.close();
		}
		catch (BrokerException e) {
			if (failure == null) {
				throw e;
			}
			failure.addSuppressed(e);
		}
		finally {
			state = PublisherState.TERMINATED;
		}
	}

	private String routingValue(ObjectNode record) {
		JsonNode value = JsonPaths.read(record, route.keyPath());
		if (!value.isTextual() || value.asText().isEmpty()) {
			throw new RoutingKeyValidationException(route.collection(), record.path(Persister.ID_FIELD).asLong(),
					route.keyPath(), value.isMissingNode() ? "nothing" : value.getNodeType() + " " + value);
		}
		return value.asText();
	}

	/**
	 * Objects (without their store id) and arrays are sent as JSON, scalars as text.
	 */
	private byte[] payload(ObjectNode record) {
		JsonNode value = JsonPaths.read(record, route.payloadPath());
		if (value.isMissingNode() || value.isNull()) {
			logger.warn("Record {} has no payload at '{}'", record.path(Persister.ID_FIELD).asLong(),
					route.payloadPath());
			return new byte[0];
		}
		if (value.isValueNode()) {
			return value.asText().getBytes(StandardCharsets.UTF_8);
		}
		JsonNode body = value;
		if (value instanceof ObjectNode object) {
			ObjectNode copy = object.deepCopy();
			copy.remove(Persister.ID_FIELD);
			body = copy;
		}
		try {
			return objectMapper.writeValueAsBytes(body);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize record " + record.path(Persister.ID_FIELD).asLong(), e);
		}
	}

}
