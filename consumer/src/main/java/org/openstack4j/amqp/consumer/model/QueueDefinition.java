package org.openstack4j.amqp.consumer.model;

import java.util.Objects;

/**
 * Identity of a broker queue together with its binding.
 *
 * <p>Two providers whose definitions are equal share one broker consumer.
 * The queue, the exchange (when present) and the binding are declared
 * before the consumer subscribes.</p>
 *
 * @param name       queue name
 * @param exchange   exchange to bind to, or {@code null} for the default exchange
 * @param routingKey binding key; ignored without an exchange
 * @param durable    queue survives a broker restart
 * @param autoDelete queue is deleted once its last consumer goes away
 * @param exclusive  queue is private to the declaring connection
 */
public record QueueDefinition(String name, ExchangeDefinition exchange, String routingKey,
                              boolean durable, boolean autoDelete, boolean exclusive) {

    public QueueDefinition {
        Objects.requireNonNull(name, "name");
        if (routingKey == null) {
            routingKey = "";
        }
    }

    /**
     * Durable queue bound to {@code exchange} with an empty routing key.
     */
    public QueueDefinition(String name, ExchangeDefinition exchange) {
        this(name, exchange, "", true, false, false);
    }

    /**
     * Durable queue on the default exchange.
     */
    public QueueDefinition(String name) {
        this(name, null, "", true, false, false);
    }

    public boolean isBound() {
        return exchange != null;
    }
}
