package org.openstack4j.amqp.consumer.manager;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openstack4j.amqp.consumer.model.QueueDefinition;

import static org.assertj.core.api.Assertions.*;

class PendingAckTrackerTest {

    private static final QueueDefinition HAM = new QueueDefinition("ham");
    private static final QueueDefinition EGGS = new QueueDefinition("eggs");

    private PendingAckTracker tracker;
    private QueueConsumer owner;

    @BeforeEach
    void setUp() {
        tracker = new PendingAckTracker();
        owner = new QueueConsumer("amqp://localhost", 3);
    }

    private DeliveredMessage message(QueueDefinition queue, long tag) {
        return new DeliveredMessage(owner, 1, queue, new Envelope(tag, false, "", queue.name()),
                new AMQP.BasicProperties(), new byte[0]);
    }

    @Test
    void countsPerQueue() {
        tracker.track(message(HAM, 1));
        tracker.track(message(HAM, 2));
        tracker.track(message(EGGS, 3));

        assertThat(tracker.pendingCount(HAM)).isEqualTo(2);
        assertThat(tracker.pendingCount(EGGS)).isEqualTo(1);
        assertThat(tracker.totalPending()).isEqualTo(3);
    }

    @Test
    void settleDecrementsOnce() {
        DeliveredMessage message = message(HAM, 1);
        tracker.track(message);

        assertThat(tracker.settle(message)).isTrue();
        assertThat(tracker.settle(message)).isFalse();
        assertThat(tracker.pendingCount(HAM)).isZero();
    }

    @Test
    void settlingAnUntrackedMessageLeavesCountsAlone() {
        tracker.track(message(HAM, 1));

        assertThat(tracker.settle(message(HAM, 1))).isFalse();
        assertThat(tracker.pendingCount(HAM)).isEqualTo(1);
    }

    @Test
    void invalidateAllDropsEverything() {
        tracker.track(message(HAM, 1));
        tracker.track(message(EGGS, 2));

        assertThat(tracker.invalidateAll()).isEqualTo(2);
        assertThat(tracker.totalPending()).isZero();
        assertThat(tracker.pendingCount(HAM)).isZero();
    }
}
