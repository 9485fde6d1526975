package org.openstack4j.amqp.consumer.manager;

import org.openstack4j.amqp.consumer.model.QueueDefinition;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Delivered but unsettled messages, grouped by queue.
 *
 * <p>Written by the event loop only; counts are also read by status calls.</p>
 */
class PendingAckTracker {

    /** queue → messages awaiting ack or requeue */
    private final Map<QueueDefinition, Set<DeliveredMessage>> pending = new LinkedHashMap<>();

    synchronized void track(DeliveredMessage message) {
        pending.computeIfAbsent(message.getQueue(),
                q -> Collections.newSetFromMap(new IdentityHashMap<>())).add(message);
    }

    /**
     * @return false if the message is not pending (already settled or invalidated)
     */
    synchronized boolean settle(DeliveredMessage message) {
        Set<DeliveredMessage> messages = pending.get(message.getQueue());
        if (messages == null || !messages.remove(message)) {
            return false;
        }
        if (messages.isEmpty()) {
            pending.remove(message.getQueue());
        }
        return true;
    }

    synchronized int pendingCount(QueueDefinition queue) {
        Set<DeliveredMessage> messages = pending.get(queue);
        return messages == null ? 0 : messages.size();
    }

    synchronized int totalPending() {
        return pending.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Forget every pending message. Used when the channel that delivered them
     * is gone and the broker has taken them back.
     *
     * @return number of messages dropped
     */
    synchronized int invalidateAll() {
        int dropped = totalPending();
        pending.clear();
        return dropped;
    }
}
