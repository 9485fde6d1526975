package org.openstack4j.amqp.consumer.manager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openstack4j.amqp.consumer.model.ExchangeDefinition;
import org.openstack4j.amqp.consumer.model.QueueDefinition;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

class ConsumerRegistryTest {

    private static final ExchangeDefinition SPAM = new ExchangeDefinition("spam");
    private static final QueueDefinition HAM = new QueueDefinition("ham", SPAM);
    private static final QueueDefinition EGGS = new QueueDefinition("eggs", SPAM);

    private ConsumerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConsumerRegistry();
    }

    @Test
    void registeringTheSameProviderTwiceIsIgnored() {
        RecordingProvider provider = new RecordingProvider("p1", HAM);

        assertThat(registry.register(provider)).isTrue();
        assertThat(registry.register(provider)).isFalse();

        assertThat(registry.providersFor(HAM)).containsExactly(provider);
    }

    @Test
    void equalQueueDefinitionsShareOneEntry() {
        RecordingProvider first = new RecordingProvider("first", HAM);
        RecordingProvider second = new RecordingProvider("second", new QueueDefinition("ham", SPAM));

        registry.register(first);
        registry.register(second);

        assertThat(registry.providersFor(HAM)).containsExactly(first, second);
        assertThat(registry.queuesNeedingActivation()).containsExactly(HAM);
    }

    @Test
    void activatedQueuesNoLongerNeedActivation() {
        registry.register(new RecordingProvider("p1", HAM));
        registry.register(new RecordingProvider("p2", EGGS));

        registry.activated(HAM, "ctag-1");

        assertThat(registry.queuesNeedingActivation()).containsExactly(EGGS);
        assertThat(registry.consumerTag(HAM)).isEqualTo("ctag-1");
        assertThat(registry.activeConsumerCount()).isEqualTo(1);
    }

    @Test
    void unregisteringOneOfSeveralProvidersCompletesImmediately() {
        RecordingProvider first = new RecordingProvider("first", HAM);
        RecordingProvider second = new RecordingProvider("second", HAM);
        registry.register(first);
        registry.register(second);
        registry.activated(HAM, "ctag-1");

        CompletableFuture<Void> drained = registry.unregister(first);

        assertThat(drained).isDone();
        assertThat(registry.providersFor(HAM)).containsExactly(second);
        assertThat(registry.queuesNeedingCancellation(q -> 0)).isEmpty();
    }

    @Test
    void lastProviderWaitsForPendingAcksBeforeCancellation() {
        RecordingProvider provider = new RecordingProvider("p1", HAM);
        registry.register(provider);
        registry.activated(HAM, "ctag-1");

        CompletableFuture<Void> drained = registry.unregister(provider);

        assertThat(drained).isNotDone();
        assertThat(registry.providersFor(HAM)).isEmpty();
        assertThat(registry.queuesNeedingCancellation(q -> 1)).isEmpty();
        assertThat(registry.queuesNeedingCancellation(q -> 0)).containsExactly(HAM);

        registry.deactivated(HAM);
        assertThat(registry.release(q -> 0)).containsExactly(HAM);

        assertThat(drained).isCompleted();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void releaseKeepsQueuesWithPendingMessages() {
        RecordingProvider provider = new RecordingProvider("p1", HAM);
        registry.register(provider);
        CompletableFuture<Void> drained = registry.unregister(provider);

        assertThat(registry.release(q -> 2)).isEmpty();
        assertThat(drained).isNotDone();

        assertThat(registry.release(q -> 0)).containsExactly(HAM);
        assertThat(drained).isCompleted();
    }

    @Test
    void reRegisteringSupersedesAPendingDrain() {
        RecordingProvider first = new RecordingProvider("first", HAM);
        RecordingProvider second = new RecordingProvider("second", HAM);
        registry.register(first);
        registry.activated(HAM, "ctag-1");
        CompletableFuture<Void> drained = registry.unregister(first);

        registry.register(second);

        assertThat(drained).isCompleted();
        assertThat(registry.queuesNeedingCancellation(q -> 0)).isEmpty();
    }

    @Test
    void unknownProviderIsRejected() {
        assertThatThrownBy(() -> registry.unregister(new RecordingProvider("stranger", HAM)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stranger");
    }

    @Test
    void closedRegistryRejectsRegistration() {
        assertThat(registry.closeIfEmpty()).isTrue();

        assertThatThrownBy(() -> registry.register(new RecordingProvider("late", HAM)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("stopped");
    }

    @Test
    void closeIfEmptyKeepsRegistryWithEntriesOpen() {
        registry.register(new RecordingProvider("p1", HAM));

        assertThat(registry.closeIfEmpty()).isFalse();
        assertThat(registry.isClosed()).isFalse();
    }

    @Test
    void closeAndReleaseCompletesEveryDrain() {
        RecordingProvider provider = new RecordingProvider("p1", HAM);
        registry.register(provider);
        registry.activated(HAM, "ctag-1");
        CompletableFuture<Void> drained = registry.unregister(provider);

        registry.closeAndRelease();

        assertThat(drained).isCompleted();
        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.unregister(provider)).isCompleted();
    }

    @Test
    void unregisterAllReturnsOneDrainPerQueue() {
        registry.register(new RecordingProvider("p1", HAM));
        registry.register(new RecordingProvider("p2", HAM));
        registry.register(new RecordingProvider("p3", EGGS));

        List<CompletableFuture<Void>> drains = registry.unregisterAll();

        assertThat(drains).hasSize(2);
        assertThat(registry.providerCount()).isZero();
        assertThat(registry.release(q -> 0)).containsExactly(HAM, EGGS);
        assertThat(drains).allMatch(CompletableFuture::isDone);
    }

    @Test
    void clearConsumerTagsMarksQueuesForReactivation() {
        registry.register(new RecordingProvider("p1", HAM));
        registry.activated(HAM, "ctag-1");

        registry.clearConsumerTags();

        assertThat(registry.consumerTag(HAM)).isNull();
        assertThat(registry.queuesNeedingActivation()).containsExactly(HAM);
    }
}
