// file: core/src/main/java/io/mural/core/LogicalTimestamp.java
package io.mural.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Lamport timestamp: a (counter, nodeId) pair.
 * <p>
 * Ordering is lexicographic: counter first, then nodeId. Two timestamps issued by
 * different nodes with the same counter are therefore still totally ordered, which
 * is what gives every node the same display order for concurrent writes.
 * <p>
 * The order is consistent with causality (a write that observed another write has
 * a larger counter) but says nothing about wall-clock time.
 */
public record LogicalTimestamp(long counter, String nodeId) implements Comparable<LogicalTimestamp> {

    private static final Comparator<LogicalTimestamp> ORDER =
            Comparator.comparingLong(LogicalTimestamp::counter)
                    .thenComparing(LogicalTimestamp::nodeId);

    public LogicalTimestamp {
        Objects.requireNonNull(nodeId, "nodeId");
        if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
        if (counter <= 0) throw new IllegalArgumentException("counter must be > 0, got " + counter);
    }

    @Override
    public int compareTo(LogicalTimestamp other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + counter + "," + nodeId + ")";
    }
}
