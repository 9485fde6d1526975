package org.openstack4j.amqp.consumer.transport;

/**
 * Raised when a broker connection cannot be configured or opened.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
