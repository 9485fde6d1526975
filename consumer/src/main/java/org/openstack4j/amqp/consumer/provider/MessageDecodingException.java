package org.openstack4j.amqp.consumer.provider;

/**
 * Raised when a message body cannot be decoded into the provider's payload type.
 */
public class MessageDecodingException extends RuntimeException {

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
