package org.springaicommunity.github.mirror;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link BrokerChannel} on a RabbitMQ connection with publisher confirms enabled.
 *
 * <p>
 * The exchange is declared as a durable, non-auto-delete topic exchange. Delivery tags
 * are the channel's publish sequence numbers.
 */
public class RabbitBrokerChannel implements BrokerChannel {

	private static final Logger logger = LoggerFactory.getLogger(RabbitBrokerChannel.class);

	private static final AMQP.BasicProperties PERSISTENT = new AMQP.BasicProperties.Builder().deliveryMode(2).build();

	private static final AMQP.BasicProperties TRANSIENT = new AMQP.BasicProperties.Builder().deliveryMode(1).build();

	private final Connection connection;

	private final Channel channel;

	private final String exchange;

	RabbitBrokerChannel(Connection connection, Channel channel, String exchange) {
		this.connection = connection;
		this.channel = channel;
		this.exchange = exchange;
	}

	/**
	 * Connect using the AMQP settings of the given properties.
	 * @throws BrokerException if the connection or the exchange declaration fails
	 */
	public static RabbitBrokerChannel open(MirrorProperties properties) {
		ConnectionFactory factory = new ConnectionFactory();
		factory.setHost(properties.getAmqpHost());
		factory.setPort(properties.getAmqpPort());
		factory.setUsername(properties.getAmqpUsername());
		factory.setPassword(properties.getAmqpPassword());
		return open(factory, properties.getAmqpExchange());
	}

	static RabbitBrokerChannel open(ConnectionFactory factory, String exchange) {
		Connection connection = null;
		try {
			connection = factory.newConnection("github-mirror");
			Channel channel = connection.createChannel();
			channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, true, false, null);
			channel.confirmSelect();
			logger.info("Connected to {}:{}, publishing to exchange '{}'", factory.getHost(), factory.getPort(),
					exchange);
			return new RabbitBrokerChannel(connection, channel, exchange);
		}
		catch (IOException | TimeoutException e) {
			if (connection != null) {
				connection.abort();
			}
			throw new BrokerException("Failed to connect to AMQP broker at " + factory.getHost() + ":"
					+ factory.getPort(), e);
		}
	}

	@Override
	public long publish(byte[] payload, boolean persistent, String routingKey) {
		long tag = channel.getNextPublishSeqNo();
		try {
			channel.basicPublish(exchange, routingKey, persistent ? PERSISTENT : TRANSIENT, payload);
		}
		catch (IOException e) {
			throw new BrokerException("Failed to publish message with routing key " + routingKey, e);
		}
		return tag;
	}

	@Override
	public void setConfirmHandler(Consumer<ConfirmEvent> handler) {
		channel.addConfirmListener((tag, multiple) -> handler.accept(ConfirmEvent.ack(tag, multiple)),
				(tag, multiple) -> handler.accept(ConfirmEvent.nack(tag, multiple)));
	}

	@Override
	public void close() {
		if (!connection.isOpen()) {
			return;
		}
		try {
			connection.close();
			logger.debug("AMQP connection closed");
		}
		catch (IOException e) {
			throw new BrokerException("Failed to close AMQP connection", e);
		}
	}

}
