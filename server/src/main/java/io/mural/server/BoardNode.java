// file: server/src/main/java/io/mural/server/BoardNode.java
package io.mural.server;

import io.mural.core.LamportClock;
import io.mural.server.auth.SessionAuthGate;
import io.mural.server.cluster.ClusterConfig;
import io.mural.server.node.FailureSimulator;
import io.mural.server.node.NodeState;
import io.mural.server.peer.PeerClient;
import io.mural.server.peer.PeerRegistry;
import io.mural.server.replication.AntiEntropyDaemon;
import io.mural.server.replication.ReconciliationService;
import io.mural.server.replication.ReplicationManager;
import io.mural.storage.DurableMessageStore;
import io.mural.storage.FileWal;
import io.mural.storage.MessageStore;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One board node with all of its engine components wired together.
 * <p>
 * Owns: the log and store under {@code <dataDir>/<nodeId>/wal}, the clock, the
 * peer registry and clients, the replication worker pool, reconciliation, the
 * failure simulator, the auth gate and the anti-entropy daemon. Transports
 * (HTTP, gRPC) are attached from outside, so the same assembly runs in Main
 * and in multi-node tests with in-process peers.
 */
public final class BoardNode implements AutoCloseable {
    private static final Logger log = Logger.getLogger(BoardNode.class.getName());

    /** Builds the client used to reach one peer. */
    @FunctionalInterface
    public interface PeerClientFactory {
        PeerClient create(ClusterConfig.Node peer, String localNodeId);
    }

    private static final long WAL_ROTATE_BYTES = 64L * 1024 * 1024; // rotate ~64MB

    private final ClusterConfig cluster;
    private final NodeState state;
    private final LamportClock clock;
    private final FileWal wal;
    private final MessageStore store;
    private final PeerRegistry registry;
    private final Map<String, PeerClient> clients;
    private final ReplicationManager replication;
    private final ReconciliationService reconciliation;
    private final FailureSimulator simulator;
    private final SessionAuthGate auth;
    private final BoardService board;
    private final AntiEntropyDaemon antiEntropy;

    public BoardNode(ClusterConfig cluster, Path dataDir, PeerClientFactory clientFactory) {
        this.cluster = cluster;
        String nodeId = cluster.localNodeId();
        ClusterConfig.ReplicationSettings settings = cluster.replication();

        this.state = new NodeState(nodeId);
        this.clock = new LamportClock(nodeId);
        this.wal = new FileWal(dataDir.resolve(nodeId).resolve("wal"), WAL_ROTATE_BYTES);
        this.store = new DurableMessageStore(wal, clock);

        this.registry = new PeerRegistry(nodeId, cluster.nodes(), settings.failureThreshold());
        Map<String, PeerClient> cs = new LinkedHashMap<>();
        for (ClusterConfig.Node peer : cluster.peers()) {
            cs.put(peer.nodeId(), clientFactory.create(peer, nodeId));
        }
        this.clients = Map.copyOf(cs);

        ScheduledExecutorService workers = newWorkerPool(nodeId, settings.workerThreads());
        this.replication = new ReplicationManager(
                state, registry, clients, settings.retryPolicy(), settings.pushTimeout(), workers);
        this.reconciliation = new ReconciliationService(
                state, store, registry, clients, settings.pullTimeout(), settings.pushTimeout(), workers);
        this.simulator = new FailureSimulator(state, reconciliation);
        this.auth = new SessionAuthGate(cluster.users());
        this.board = new BoardService(state, clock, store, auth, replication);
        this.antiEntropy = new AntiEntropyDaemon(state, reconciliation, settings.antiEntropyInterval());
    }

    /** Start background reconciliation. */
    public void start() {
        antiEntropy.start();
    }

    @Override
    public void close() {
        antiEntropy.stop();
        replication.shutdown();
        for (PeerClient c : clients.values()) {
            try {
                c.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Failed to close client for " + c.peerId(), e);
            }
        }
        wal.close();
        log.log(Level.INFO, "Node {0} stopped", state.nodeId());
    }

    public String nodeId() {
        return state.nodeId();
    }

    public ClusterConfig cluster() {
        return cluster;
    }

    public NodeState state() {
        return state;
    }

    public LamportClock clock() {
        return clock;
    }

    public BoardService board() {
        return board;
    }

    public SessionAuthGate auth() {
        return auth;
    }

    public PeerRegistry registry() {
        return registry;
    }

    public ReplicationManager replication() {
        return replication;
    }

    public ReconciliationService reconciliation() {
        return reconciliation;
    }

    public FailureSimulator simulator() {
        return simulator;
    }

    private static ScheduledExecutorService newWorkerPool(String nodeId, int threads) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "replication-" + nodeId + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
