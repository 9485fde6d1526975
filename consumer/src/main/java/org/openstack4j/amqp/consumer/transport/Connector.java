package org.openstack4j.amqp.consumer.transport;

import com.rabbitmq.client.Connection;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens broker connections for a queue consumer.
 *
 * <p>Called from the consumer's event loop on every connection attempt.
 * {@link IOException} and {@link TimeoutException} are treated as retryable;
 * the loop waits for the configured reconnect interval and calls again.</p>
 *
 * <p>Tests substitute an implementation that fails or hands out mocks.</p>
 */
@FunctionalInterface
public interface Connector {

    /**
     * Open a new connection.
     *
     * @return an open connection, owned by the caller from now on
     * @throws IOException      on socket or protocol failures
     * @throws TimeoutException if the broker does not answer in time
     */
    Connection connect() throws IOException, TimeoutException;
}
