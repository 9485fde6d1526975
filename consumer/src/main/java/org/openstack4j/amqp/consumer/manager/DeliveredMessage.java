package org.openstack4j.amqp.consumer.manager;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import org.openstack4j.amqp.consumer.model.QueueDefinition;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A message delivered to the providers of one queue.
 *
 * <p>Settle it exactly once with {@link QueueConsumer#ackMessage(DeliveredMessage)}
 * or {@link QueueConsumer#requeueMessage(DeliveredMessage)} on the consumer
 * that delivered it. Every provider registered on the queue receives the same
 * instance.</p>
 */
public final class DeliveredMessage {

    private final QueueConsumer owner;
    private final long session;
    private final QueueDefinition queue;
    private final Envelope envelope;
    private final AMQP.BasicProperties properties;
    private final byte[] body;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    DeliveredMessage(QueueConsumer owner, long session, QueueDefinition queue,
                     Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        this.owner = owner;
        this.session = session;
        this.queue = queue;
        this.envelope = envelope;
        this.properties = properties;
        this.body = body;
    }

    public QueueDefinition getQueue() { return queue; }

    public Envelope getEnvelope() { return envelope; }

    public AMQP.BasicProperties getProperties() { return properties; }

    public byte[] getBody() { return body; }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public long getDeliveryTag() { return envelope.getDeliveryTag(); }

    public boolean isRedelivered() { return envelope.isRedeliver(); }

    public boolean isSettled() { return settled.get(); }

    boolean belongsTo(QueueConsumer consumer) {
        return owner == consumer;
    }

    long session() {
        return session;
    }

    /**
     * @return false if the message was already settled
     */
    boolean markSettled() {
        return settled.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "DeliveredMessage{queue=" + queue.name()
                + ", deliveryTag=" + envelope.getDeliveryTag()
                + ", redelivered=" + envelope.isRedeliver()
                + ", settled=" + settled.get() + "}";
    }
}
