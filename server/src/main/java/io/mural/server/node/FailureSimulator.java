// file: server/src/main/java/io/mural/server/node/FailureSimulator.java
package io.mural.server.node;

import io.mural.server.replication.ReconciliationReport;
import io.mural.server.replication.ReconciliationService;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Online/Offline state machine for outage simulation.
 * <p>
 * Transitions:
 *  - ONLINE  -> OFFLINE (goOffline): new pushes and pulls stop; writes are still
 *    accepted locally. Pushes already handed to workers are not cancelled.
 *  - OFFLINE -> ONLINE  (goOnline): the mode flips first, then a full
 *    reconciliation round starts so everything missed during the outage is
 *    exchanged with every peer.
 * Only the OFFLINE -> ONLINE edge carries a side effect; repeating a transition
 * is a no-op.
 */
public final class FailureSimulator {
    private static final Logger log = Logger.getLogger(FailureSimulator.class.getName());

    private final NodeState state;
    private final ReconciliationService reconciliation;

    public FailureSimulator(NodeState state, ReconciliationService reconciliation) {
        this.state = Objects.requireNonNull(state, "state");
        this.reconciliation = Objects.requireNonNull(reconciliation, "reconciliation");
    }

    /** @return true if the node was online and is now offline. */
    public boolean goOffline() {
        boolean changed = state.transition(NodeState.Mode.ONLINE, NodeState.Mode.OFFLINE);
        if (changed) {
            log.log(Level.INFO, "Node {0} is now OFFLINE (replication suspended)", state.nodeId());
        }
        return changed;
    }

    /**
     * Bring the node back and start catching up.
     *
     * @return the reconciliation round triggered by this transition, or an already
     *         completed empty report if the node was not offline.
     */
    public CompletableFuture<ReconciliationReport> goOnline() {
        if (!state.transition(NodeState.Mode.OFFLINE, NodeState.Mode.ONLINE)) {
            return CompletableFuture.completedFuture(ReconciliationReport.skipped("already online"));
        }
        log.log(Level.INFO, "Node {0} is back ONLINE, reconciling with peers", state.nodeId());
        return reconciliation.reconcileAllAsync();
    }

    public NodeState.Mode mode() {
        return state.mode();
    }
}
