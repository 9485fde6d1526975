package org.openstack4j.amqp.consumer.model;

import com.rabbitmq.client.BuiltinExchangeType;

import java.util.Objects;

/**
 * Exchange a queue is bound to.
 *
 * @param name    exchange name
 * @param type    exchange type (direct, topic, fanout, headers)
 * @param durable whether the exchange survives a broker restart
 */
public record ExchangeDefinition(String name, BuiltinExchangeType type, boolean durable) {

    public ExchangeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Durable direct exchange.
     */
    public ExchangeDefinition(String name) {
        this(name, BuiltinExchangeType.DIRECT, true);
    }
}
