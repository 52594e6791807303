// file: server/src/main/java/io/mural/server/replication/ReplicationManager.java
package io.mural.server.replication;

import io.mural.core.Message;
import io.mural.server.node.NodeState;
import io.mural.server.peer.PeerClient;
import io.mural.server.peer.PeerRegistry;
import io.mural.server.peer.PeerStatus;
import io.mural.server.peer.PeerUnreachableException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asynchronous fan-out of locally authored messages to peers.
 *
 * Responsibilities:
 *  - For each peer currently believed reachable, push the message on the worker
 *    pool and retry failures with {@link RetryPolicy} backoff.
 *  - Feed every attempt's result into the {@link PeerRegistry}.
 *  - Report one {@link PushOutcome} per peer. The futures always complete
 *    normally; nothing here ever fails the client's write.
 *
 * While the node is OFFLINE nothing is sent and nothing is queued: the next
 * reconciliation round carries the message instead. A node going offline between
 * retries abandons the remaining attempts.
 */
public final class ReplicationManager {
    private static final Logger log = Logger.getLogger(ReplicationManager.class.getName());

    private final NodeState state;
    private final PeerRegistry registry;
    private final Map<String, PeerClient> clients;
    private final RetryPolicy retry;
    private final Duration pushTimeout;
    private final ScheduledExecutorService workers;

    public ReplicationManager(
            NodeState state,
            PeerRegistry registry,
            Map<String, PeerClient> clients,
            RetryPolicy retry,
            Duration pushTimeout,
            ScheduledExecutorService workers
    ) {
        this.state = Objects.requireNonNull(state, "state");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clients = Map.copyOf(clients);
        this.retry = Objects.requireNonNull(retry, "retry");
        this.pushTimeout = Objects.requireNonNull(pushTimeout, "pushTimeout");
        this.workers = Objects.requireNonNull(workers, "workers");
        for (PeerStatus p : registry.listPeers()) {
            if (!this.clients.containsKey(p.peerId())) {
                throw new IllegalArgumentException("no client for peer " + p.peerId());
            }
        }
    }

    /**
     * Start replicating a message that was just stored locally.
     *
     * @return one future per configured peer
     */
    public List<CompletableFuture<PushOutcome>> onLocalWrite(Message message) {
        List<PeerStatus> peers = registry.listPeers();
        List<CompletableFuture<PushOutcome>> out = new ArrayList<>(peers.size());

        if (state.isOffline()) {
            log.log(Level.FINE, "Offline, not replicating {0}", message.id());
            for (PeerStatus p : peers) {
                out.add(CompletableFuture.completedFuture(
                        PushOutcome.skipped(p.peerId(), message.id(), PushOutcome.Status.SKIPPED_OFFLINE)));
            }
            return out;
        }

        for (PeerStatus p : peers) {
            if (!p.reachable()) {
                out.add(CompletableFuture.completedFuture(
                        PushOutcome.skipped(p.peerId(), message.id(), PushOutcome.Status.SKIPPED_UNREACHABLE)));
                continue;
            }
            CompletableFuture<PushOutcome> f = new CompletableFuture<>();
            schedule(p.peerId(), message, 1, 0L, null, f);
            out.add(f);
        }
        return out;
    }

    /** Stop the worker pool. Pending retries are dropped. */
    public void shutdown() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warning("Replication workers did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private void schedule(String peerId, Message m, int attempt, long delayMs, String lastError,
                          CompletableFuture<PushOutcome> f) {
        try {
            workers.schedule(() -> attempt(peerId, m, attempt, f), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            f.complete(new PushOutcome(peerId, m.id(), PushOutcome.Status.ABANDONED, attempt - 1,
                    lastError == null ? "replication stopped" : lastError));
        }
    }

    private void attempt(String peerId, Message m, int attempt, CompletableFuture<PushOutcome> f) {
        if (state.isOffline()) {
            log.log(Level.FINE, "Abandoning push of {0} to {1}: node offline", new Object[]{m.id(), peerId});
            f.complete(new PushOutcome(peerId, m.id(), PushOutcome.Status.ABANDONED, attempt - 1, "node offline"));
            return;
        }

        String error;
        try {
            boolean added = clients.get(peerId).push(m, pushTimeout);
            registry.markResult(peerId, true);
            log.log(Level.FINE, "Pushed {0} to {1} (attempt {2}, added={3})",
                    new Object[]{m.id(), peerId, attempt, added});
            f.complete(new PushOutcome(peerId, m.id(), PushOutcome.Status.DELIVERED, attempt, null));
            return;
        } catch (PeerUnreachableException e) {
            error = e.getMessage();
        } catch (RuntimeException e) {
            error = e.toString();
        }

        registry.markResult(peerId, false);
        if (!retry.hasAttemptsLeft(attempt)) {
            log.log(Level.WARNING, "Giving up push of {0} to {1} after {2} attempts: {3}",
                    new Object[]{m.id(), peerId, attempt, error});
            f.complete(new PushOutcome(peerId, m.id(), PushOutcome.Status.ABANDONED, attempt, error));
            return;
        }
        long delay = retry.delayAfter(attempt).toMillis();
        log.log(Level.FINE, "Push of {0} to {1} failed (attempt {2}), retrying in {3} ms: {4}",
                new Object[]{m.id(), peerId, attempt, delay, error});
        schedule(peerId, m, attempt + 1, delay, error, f);
    }
}
