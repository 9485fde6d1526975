package org.openstack4j.amqp.consumer.manager;

/**
 * Raised when a message is settled that this consumer did not deliver,
 * or that has already been acknowledged or requeued.
 */
public class UnknownMessageException extends IllegalStateException {

    public UnknownMessageException(String message) {
        super(message);
    }
}
