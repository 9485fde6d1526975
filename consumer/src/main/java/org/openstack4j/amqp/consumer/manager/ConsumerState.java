package org.openstack4j.amqp.consumer.manager;

/**
 * Lifecycle of a {@link QueueConsumer}.
 *
 * <pre>
 * IDLE --start()--&gt; STARTING --connected--&gt; RUNNING --no providers left--&gt; STOPPED
 *                      |   ^                    |
 *                      |   +---connection lost--+
 *                      +--no providers left before connecting--&gt; STOPPED
 * </pre>
 */
public enum ConsumerState {
    /** Constructed, event loop not started. */
    IDLE,
    /** Event loop is (re)connecting to the broker. */
    STARTING,
    /** Connected; broker consumers follow the registered providers. */
    RUNNING,
    /** Event loop has exited. Terminal. */
    STOPPED
}
