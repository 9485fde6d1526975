package org.openstack4j.amqp.consumer.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.openstack4j.amqp.consumer.manager.DeliveredMessage;
import org.openstack4j.amqp.consumer.model.QueueDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link MessageProvider} that decodes JSON bodies before handing them on.
 *
 * <p>Bodies are parsed with the supplied {@link ObjectMapper} into
 * {@code payloadType}. A body that does not parse raises
 * {@link MessageDecodingException}; the message is left unsettled, as for any
 * other handler failure.</p>
 *
 * @param <T> payload type
 */
public abstract class JsonMessageProvider<T> implements MessageProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonMessageProvider.class);

    private final QueueDefinition queue;
    private final Class<T> payloadType;
    private final ObjectMapper objectMapper;

    protected JsonMessageProvider(QueueDefinition queue, Class<T> payloadType) {
        this(queue, payloadType, new ObjectMapper());
    }

    protected JsonMessageProvider(QueueDefinition queue, Class<T> payloadType, ObjectMapper objectMapper) {
        this.queue = queue;
        this.payloadType = payloadType;
        this.objectMapper = objectMapper;
    }

    @Override
    public QueueDefinition getQueue() {
        return queue;
    }

    @Override
    public final void handleMessage(byte[] body, DeliveredMessage message) throws Exception {
        handle(decode(body), message);
    }

    /**
     * Called with the decoded payload.
     */
    protected abstract void handle(T payload, DeliveredMessage message) throws Exception;

    T decode(byte[] body) {
        try {
            return objectMapper.readValue(body, payloadType);
        } catch (IOException e) {
            if (log.isDebugEnabled()) {
                log.debug("Undecodable body on queue {}: {}", queue.name(),
                        new String(body, StandardCharsets.UTF_8));
            }
            throw new MessageDecodingException(
                    "Failed to decode " + payloadType.getSimpleName() + " from queue " + queue.name(), e);
        }
    }
}
