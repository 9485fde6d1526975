package org.openstack4j.amqp.consumer.provider;

import org.openstack4j.amqp.consumer.manager.DeliveredMessage;
import org.openstack4j.amqp.consumer.model.QueueDefinition;

/**
 * Message handler bound to one queue.
 *
 * <p>Register implementations with
 * {@link org.openstack4j.amqp.consumer.manager.QueueConsumer#registerProvider(MessageProvider)}.
 * Several providers may target the same queue; they then share one broker
 * consumer and each sees every delivery of that queue.</p>
 *
 * <p>Handlers run on the queue consumer's event loop thread. A handler that
 * blocks holds up every other queue served by the same consumer. Each
 * delivery must eventually be settled through
 * {@link org.openstack4j.amqp.consumer.manager.QueueConsumer#ackMessage(DeliveredMessage)}
 * or {@link org.openstack4j.amqp.consumer.manager.QueueConsumer#requeueMessage(DeliveredMessage)},
 * otherwise unregistering the provider never completes.</p>
 *
 * <p>Example usage:</p>
 * <pre>
 * consumer.registerProvider(new MessageProvider() {
 *     public QueueDefinition getQueue() { return ordersQueue; }
 *     public void handleMessage(byte[] body, DeliveredMessage message) {
 *         process(body);
 *         consumer.ackMessage(message);
 *     }
 * });
 * </pre>
 */
public interface MessageProvider {

    /**
     * @return the queue this provider consumes from; must not change while registered
     */
    QueueDefinition getQueue();

    /**
     * Called once per delivery on {@link #getQueue()}.
     *
     * <p>An exception thrown here is logged and otherwise ignored; the message
     * stays unacknowledged. Call {@code requeueMessage} before throwing if the
     * message should be redelivered.</p>
     *
     * @param body    raw message body
     * @param message handle used to settle the delivery
     */
    void handleMessage(byte[] body, DeliveredMessage message) throws Exception;
}
