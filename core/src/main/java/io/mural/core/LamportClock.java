// file: core/src/main/java/io/mural/core/LamportClock.java
package io.mural.core;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-node Lamport clock.
 * <p>
 * Contract:
 *  - next() returns a timestamp strictly greater than every timestamp this clock
 *    returned before and than every counter passed to observe().
 *  - observe(c) advances the local counter to max(local, c); the following next()
 *    then increments past it.
 * <p>
 * Lock free: the counter is a single AtomicLong, so concurrent local writes and
 * merges never see the same value twice.
 */
public final class LamportClock {

    private final String nodeId;
    private final AtomicLong counter;

    public LamportClock(String nodeId) {
        this(nodeId, 0L);
    }

    /**
     * @param initialCounter last counter known to be used, e.g. recovered from disk.
     */
    public LamportClock(String nodeId, long initialCounter) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
        if (initialCounter < 0) throw new IllegalArgumentException("initialCounter must be >= 0");
        this.counter = new AtomicLong(initialCounter);
    }

    /** Tick for a local event. */
    public LogicalTimestamp next() {
        return new LogicalTimestamp(counter.incrementAndGet(), nodeId);
    }

    /** Lamport advancement on receipt of a counter from another node (or from disk). */
    public void observe(long remoteCounter) {
        counter.accumulateAndGet(remoteCounter, Math::max);
    }

    /** Highest counter issued or observed so far. */
    public long current() {
        return counter.get();
    }

    public String nodeId() {
        return nodeId;
    }
}
