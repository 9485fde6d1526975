package org.openstack4j.amqp.consumer.transport;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.openstack4j.amqp.consumer.config.ConsumerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeoutException;

/**
 * {@link Connector} backed by the RabbitMQ Java client.
 *
 * <p>Automatic recovery is switched off: after a connection loss the queue
 * consumer reconnects through this connector and re-subscribes its own
 * consumers, so the client must not restore them a second time.</p>
 */
public class RabbitConnector implements Connector {

    private static final Logger log = LoggerFactory.getLogger(RabbitConnector.class);

    private final ConsumerConfig config;

    public RabbitConnector(ConsumerConfig config) {
        this.config = config;
    }

    @Override
    public Connection connect() throws IOException, TimeoutException {
        ConnectionFactory factory = createConnectionFactory();
        Connection connection = factory.newConnection(config.getConnectionName());
        log.info("Connected to {}:{}{} as '{}'", factory.getHost(), factory.getPort(),
                factory.getVirtualHost(), config.getConnectionName());
        return connection;
    }

    ConnectionFactory createConnectionFactory() {
        if (config.getUri() == null) {
            throw new TransportException("No broker URI configured");
        }

        ConnectionFactory factory = new ConnectionFactory();
        try {
            // amqps:// URIs switch on TLS as well
            factory.setUri(config.getUri());
        } catch (URISyntaxException | GeneralSecurityException e) {
            throw new TransportException("Invalid broker URI: " + config.getUri(), e);
        } catch (IllegalArgumentException e) {
            throw new TransportException("Unsupported broker URI: " + config.getUri(), e);
        }
        factory.setConnectionTimeout(config.getConnectionTimeout());
        factory.setRequestedHeartbeat(config.getHeartbeat());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        return factory;
    }
}
