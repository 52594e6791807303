// file: server/src/main/java/io/mural/server/peer/PeerRegistry.java
package io.mural.server.peer;

import io.mural.server.cluster.ClusterConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configured peer set and the local belief about each peer's reachability.
 * <p>
 * Rules for markResult():
 *  - success: consecutiveFailures = 0, reachable = true.
 *  - failure: consecutiveFailures + 1; reachable becomes false only once the
 *    count reaches failureThreshold, so a single transient error does not flip
 *    a peer to degraded.
 * <p>
 * The peer list is fixed at construction (configuration order, self excluded);
 * only the per-peer state changes. All access is synchronized on the registry.
 */
public final class PeerRegistry {
    private static final Logger log = Logger.getLogger(PeerRegistry.class.getName());

    private static final class Entry {
        final String peerId;
        final String address;
        boolean reachable = true;
        int consecutiveFailures = 0;

        Entry(String peerId, String address) {
            this.peerId = peerId;
            this.address = address;
        }

        PeerStatus view() {
            return new PeerStatus(peerId, address, reachable, consecutiveFailures);
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final int failureThreshold;

    public PeerRegistry(String localNodeId, List<ClusterConfig.Node> nodes, int failureThreshold) {
        Objects.requireNonNull(localNodeId, "localNodeId");
        Objects.requireNonNull(nodes, "nodes");
        if (failureThreshold <= 0) throw new IllegalArgumentException("failureThreshold must be > 0");
        this.failureThreshold = failureThreshold;
        for (ClusterConfig.Node n : nodes) {
            if (n.nodeId().equals(localNodeId)) continue;
            if (entries.putIfAbsent(n.nodeId(), new Entry(n.nodeId(), n.host() + ":" + n.grpcPort())) != null) {
                throw new IllegalArgumentException("duplicate peer id " + n.nodeId());
            }
        }
    }

    /** All peers in configuration order, self excluded. */
    public synchronized List<PeerStatus> listPeers() {
        List<PeerStatus> out = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) out.add(e.view());
        return out;
    }

    /** Peers currently believed reachable, in configuration order. */
    public synchronized List<PeerStatus> reachablePeers() {
        List<PeerStatus> out = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) {
            if (e.reachable) out.add(e.view());
        }
        return out;
    }

    public synchronized Optional<PeerStatus> find(String peerId) {
        Entry e = entries.get(peerId);
        return e == null ? Optional.empty() : Optional.of(e.view());
    }

    /** Record the outcome of one network attempt against {@code peerId}. */
    public synchronized void markResult(String peerId, boolean success) {
        Entry e = entries.get(peerId);
        if (e == null) {
            throw new IllegalArgumentException("unknown peer " + peerId);
        }
        if (success) {
            if (!e.reachable) {
                log.log(Level.INFO, "Peer {0} reachable again", peerId);
            }
            e.consecutiveFailures = 0;
            e.reachable = true;
            return;
        }
        e.consecutiveFailures++;
        if (e.reachable && e.consecutiveFailures >= failureThreshold) {
            e.reachable = false;
            log.log(Level.WARNING, "Peer {0} marked unreachable after {1} consecutive failures",
                    new Object[]{peerId, e.consecutiveFailures});
        }
    }

    public int failureThreshold() {
        return failureThreshold;
    }
}
