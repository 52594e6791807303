// file: server/src/main/java/io/mural/server/replication/ReconciliationService.java
package io.mural.server.replication;

import io.mural.core.Message;
import io.mural.core.MessageId;
import io.mural.server.node.NodeState;
import io.mural.server.peer.PeerClient;
import io.mural.server.peer.PeerRegistry;
import io.mural.server.peer.PeerStatus;
import io.mural.server.peer.PeerUnreachableException;
import io.mural.storage.MessageStore;
import io.mural.storage.StorageException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Push-pull anti-entropy between this node and its peers.
 * <p>
 * One exchange with a peer:
 *  1) pull the peer's full message set and merge it locally;
 *  2) push back every local message the peer did not have.
 * Both directions go through idempotent operations, so a round that is cut
 * short or repeated never harms; against a peer that is already in sync a round
 * changes nothing.
 * <p>
 * Peers are reconciled independently and in parallel on the worker pool. A peer
 * that fails is marked in the registry, logged and left for the next round.
 * Rounds are skipped while the node is OFFLINE.
 */
public final class ReconciliationService {
    private static final Logger log = Logger.getLogger(ReconciliationService.class.getName());

    private final NodeState state;
    private final MessageStore store;
    private final PeerRegistry registry;
    private final Map<String, PeerClient> clients;
    private final Duration pullTimeout;
    private final Duration pushTimeout;
    private final Executor workers;

    public ReconciliationService(
            NodeState state,
            MessageStore store,
            PeerRegistry registry,
            Map<String, PeerClient> clients,
            Duration pullTimeout,
            Duration pushTimeout,
            Executor workers
    ) {
        this.state = Objects.requireNonNull(state, "state");
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clients = Map.copyOf(clients);
        this.pullTimeout = Objects.requireNonNull(pullTimeout, "pullTimeout");
        this.pushTimeout = Objects.requireNonNull(pushTimeout, "pushTimeout");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    /**
     * Run one exchange with {@code peerId} on the calling thread.
     *
     * @throws IllegalArgumentException if the peer is not configured
     */
    public PeerSyncResult reconcileWith(String peerId) {
        PeerClient client = clients.get(peerId);
        if (client == null || registry.find(peerId).isEmpty()) {
            throw new IllegalArgumentException("unknown peer " + peerId);
        }
        if (state.isOffline()) {
            return PeerSyncResult.failed(peerId, 0, 0, "local node offline");
        }

        int pulled = 0;
        int pushedBack = 0;
        try {
            List<Message> remote = client.pullSnapshot(pullTimeout);
            pulled = store.merge(remote);

            Set<MessageId> remoteIds = new HashSet<>(remote.size() * 2);
            for (Message m : remote) remoteIds.add(m.id());

            for (Message m : store.orderedView()) {
                if (remoteIds.contains(m.id())) continue;
                if (state.isOffline()) {
                    return PeerSyncResult.failed(peerId, pulled, pushedBack, "local node went offline");
                }
                client.push(m, pushTimeout);
                pushedBack++;
            }

            registry.markResult(peerId, true);
            if (pulled > 0 || pushedBack > 0) {
                log.log(Level.INFO, "Reconciled with {0}: pulled={1} pushedBack={2}",
                        new Object[]{peerId, pulled, pushedBack});
            }
            return PeerSyncResult.ok(peerId, pulled, pushedBack);
        } catch (PeerUnreachableException e) {
            registry.markResult(peerId, false);
            log.log(Level.WARNING, "Reconciliation with {0} failed: {1}", new Object[]{peerId, e.getMessage()});
            return PeerSyncResult.failed(peerId, pulled, pushedBack, e.getMessage());
        } catch (StorageException e) {
            // local failure; says nothing about the peer
            log.log(Level.WARNING, "Reconciliation with " + peerId + " failed to persist pulled messages", e);
            return PeerSyncResult.failed(peerId, pulled, pushedBack, e.getMessage());
        } catch (RuntimeException e) {
            registry.markResult(peerId, false);
            log.log(Level.WARNING, "Reconciliation with " + peerId + " failed", e);
            return PeerSyncResult.failed(peerId, pulled, pushedBack, e.toString());
        }
    }

    /** Reconcile with every configured peer in parallel and wait for the report. */
    public ReconciliationReport reconcileAll() {
        return reconcileAllAsync().join();
    }

    /**
     * Start a round over every configured peer without blocking the caller.
     * The returned future always completes normally.
     */
    public CompletableFuture<ReconciliationReport> reconcileAllAsync() {
        if (state.isOffline()) {
            log.fine("Skipping reconciliation round: node offline");
            return CompletableFuture.completedFuture(ReconciliationReport.skipped("node offline"));
        }
        List<PeerStatus> peers = registry.listPeers();
        if (peers.isEmpty()) {
            return CompletableFuture.completedFuture(ReconciliationReport.of(List.of()));
        }

        List<CompletableFuture<PeerSyncResult>> pending = new ArrayList<>(peers.size());
        for (PeerStatus p : peers) {
            pending.add(startExchange(p.peerId()));
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    List<PeerSyncResult> results = new ArrayList<>(pending.size());
                    for (CompletableFuture<PeerSyncResult> f : pending) results.add(f.join());
                    ReconciliationReport report = ReconciliationReport.of(results);
                    if (report.partialFailure()) {
                        log.log(Level.WARNING, "Reconciliation round incomplete, failed peers: {0}",
                                report.failedPeers());
                    } else {
                        log.log(Level.FINE, "Reconciliation round done: pulled={0} pushedBack={1}",
                                new Object[]{report.pulled(), report.pushedBack()});
                    }
                    return report;
                });
    }

    private CompletableFuture<PeerSyncResult> startExchange(String peerId) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> reconcileWith(peerId), workers)
                    .exceptionally(t -> PeerSyncResult.failed(peerId, 0, 0, t.toString()));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                    PeerSyncResult.failed(peerId, 0, 0, "reconciliation workers stopped"));
        }
    }
}
