package org.openstack4j.amqp.consumer.manager;

import org.openstack4j.amqp.consumer.model.QueueDefinition;
import org.openstack4j.amqp.consumer.provider.MessageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.ToIntFunction;

/**
 * Providers grouped by queue, plus the broker consumer tag of each queue.
 *
 * <p>Shared between the event loop and the callers of
 * {@link QueueConsumer}. Every method is atomic; drain futures are completed
 * outside the monitor so their callbacks never run under it.</p>
 */
class ConsumerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConsumerRegistry.class);

    private static final class Entry {
        /** registration order, de-duplicated by identity */
        final List<MessageProvider> providers = new ArrayList<>();
        /** null until the loop subscribes */
        String consumerTag;
        final List<CompletableFuture<Void>> drainWaiters = new ArrayList<>();

        boolean contains(MessageProvider provider) {
            for (MessageProvider p : providers) {
                if (p == provider) return true;
            }
            return false;
        }

        boolean remove(MessageProvider provider) {
            for (int i = 0; i < providers.size(); i++) {
                if (providers.get(i) == provider) {
                    providers.remove(i);
                    return true;
                }
            }
            return false;
        }
    }

    private final Map<QueueDefinition, Entry> entries = new LinkedHashMap<>();
    private boolean closed = false;

    /**
     * @return false if the provider was already registered
     * @throws IllegalStateException once the registry is closed
     */
    boolean register(MessageProvider provider) {
        List<CompletableFuture<Void>> superseded;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Queue consumer is stopped, cannot register " + provider);
            }
            Entry entry = entries.computeIfAbsent(provider.getQueue(), q -> new Entry());
            if (entry.contains(provider)) {
                return false;
            }
            entry.providers.add(provider);
            // a queue that regains a provider is no longer being drained
            superseded = new ArrayList<>(entry.drainWaiters);
            entry.drainWaiters.clear();
        }
        superseded.forEach(f -> f.complete(null));
        return true;
    }

    /**
     * Remove a provider. It receives no further deliveries once this returns.
     *
     * @return completes when the provider's queue no longer needs draining
     * @throws IllegalArgumentException if the provider is not registered
     */
    synchronized CompletableFuture<Void> unregister(MessageProvider provider) {
        if (closed) {
            return CompletableFuture.completedFuture(null);
        }
        Entry entry = entries.get(provider.getQueue());
        if (entry == null || !entry.remove(provider)) {
            throw new IllegalArgumentException("Provider is not registered: " + provider);
        }
        if (!entry.providers.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> drained = new CompletableFuture<>();
        entry.drainWaiters.add(drained);
        return drained;
    }

    /**
     * Remove every provider at once.
     *
     * @return one drain future per queue that lost its last provider
     */
    synchronized List<CompletableFuture<Void>> unregisterAll() {
        List<CompletableFuture<Void>> drains = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.providers.isEmpty() && entry.drainWaiters.isEmpty()) {
                continue;
            }
            entry.providers.clear();
            CompletableFuture<Void> drained = new CompletableFuture<>();
            entry.drainWaiters.add(drained);
            drains.add(drained);
        }
        return drains;
    }

    /**
     * @return snapshot of the providers currently registered for {@code queue}
     */
    synchronized List<MessageProvider> providersFor(QueueDefinition queue) {
        Entry entry = entries.get(queue);
        return entry == null ? List.of() : List.copyOf(entry.providers);
    }

    synchronized List<QueueDefinition> queuesNeedingActivation() {
        List<QueueDefinition> result = new ArrayList<>();
        entries.forEach((queue, entry) -> {
            if (!entry.providers.isEmpty() && entry.consumerTag == null) {
                result.add(queue);
            }
        });
        return result;
    }

    synchronized List<QueueDefinition> queuesNeedingCancellation(ToIntFunction<QueueDefinition> pendingCount) {
        List<QueueDefinition> result = new ArrayList<>();
        entries.forEach((queue, entry) -> {
            if (entry.providers.isEmpty() && entry.consumerTag != null
                    && pendingCount.applyAsInt(queue) == 0) {
                result.add(queue);
            }
        });
        return result;
    }

    synchronized void activated(QueueDefinition queue, String consumerTag) {
        Entry entry = entries.get(queue);
        if (entry != null) {
            entry.consumerTag = consumerTag;
        }
    }

    synchronized void deactivated(QueueDefinition queue) {
        Entry entry = entries.get(queue);
        if (entry != null) {
            entry.consumerTag = null;
        }
    }

    synchronized String consumerTag(QueueDefinition queue) {
        Entry entry = entries.get(queue);
        return entry == null ? null : entry.consumerTag;
    }

    /**
     * Forget all consumer tags after the channel carrying them closed.
     */
    synchronized void clearConsumerTags() {
        entries.values().forEach(entry -> entry.consumerTag = null);
    }

    /**
     * Drop queues that have no providers, no broker consumer and nothing
     * pending, and complete their drain futures.
     *
     * @return the released queues
     */
    List<QueueDefinition> release(ToIntFunction<QueueDefinition> pendingCount) {
        List<QueueDefinition> released = new ArrayList<>();
        List<CompletableFuture<Void>> drained = new ArrayList<>();
        synchronized (this) {
            var it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<QueueDefinition, Entry> e = it.next();
                Entry entry = e.getValue();
                if (entry.providers.isEmpty() && entry.consumerTag == null
                        && pendingCount.applyAsInt(e.getKey()) == 0) {
                    released.add(e.getKey());
                    drained.addAll(entry.drainWaiters);
                    it.remove();
                }
            }
        }
        drained.forEach(f -> f.complete(null));
        if (!released.isEmpty()) {
            log.debug("Released drained queues: {}", released);
        }
        return released;
    }

    /**
     * Close the registry if it holds no queue at all.
     *
     * @return true if the registry is (now) closed
     */
    synchronized boolean closeIfEmpty() {
        if (entries.isEmpty()) {
            closed = true;
        }
        return closed;
    }

    /**
     * Close unconditionally, dropping every entry and completing every drain future.
     */
    void closeAndRelease() {
        List<CompletableFuture<Void>> drained = new ArrayList<>();
        synchronized (this) {
            closed = true;
            entries.values().forEach(entry -> drained.addAll(entry.drainWaiters));
            entries.clear();
        }
        drained.forEach(f -> f.complete(null));
    }

    synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    synchronized boolean isClosed() {
        return closed;
    }

    synchronized int activeConsumerCount() {
        return (int) entries.values().stream().filter(entry -> entry.consumerTag != null).count();
    }

    synchronized int providerCount() {
        return entries.values().stream().mapToInt(entry -> entry.providers.size()).sum();
    }
}
