// file: server/src/main/java/io/mural/server/node/NodeState.java
package io.mural.server.node;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Self-state of the local node: its id and whether it is simulating an outage.
 * <p>
 * One instance per node, handed to every component that needs it. The mode is only
 * changed by {@link FailureSimulator}; replication and reconciliation read it
 * before each network attempt.
 */
public final class NodeState {

    public enum Mode {
        ONLINE,
        OFFLINE
    }

    private final String nodeId;
    private final AtomicReference<Mode> mode = new AtomicReference<>(Mode.ONLINE);

    public NodeState(String nodeId) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    }

    public String nodeId() {
        return nodeId;
    }

    public Mode mode() {
        return mode.get();
    }

    public boolean isOffline() {
        return mode.get() == Mode.OFFLINE;
    }

    /** Atomic edge transition; false if the node was not in {@code from}. */
    boolean transition(Mode from, Mode to) {
        return mode.compareAndSet(from, to);
    }
}
