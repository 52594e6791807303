// file: server/src/main/java/io/mural/server/BoardService.java
package io.mural.server;

import io.mural.core.LamportClock;
import io.mural.core.Message;
import io.mural.server.auth.AuthGate;
import io.mural.server.auth.AuthorizationException;
import io.mural.server.node.NodeOfflineException;
import io.mural.server.node.NodeState;
import io.mural.server.peer.ReplicaEndpoint;
import io.mural.server.replication.ReplicationManager;
import io.mural.storage.MessageStore;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-node message board engine.
 * <p>
 * Responsibilities:
 *  - Authenticate and validate client writes, stamp them with the Lamport clock,
 *    store them durably and hand them to replication.
 *  - Serve the local board in display order.
 *  - Act as the ReplicaEndpoint for pushes and pulls from peers.
 * <p>
 * A write is acknowledged once it is durable locally; replication runs in the
 * background and its failures never reach the client. Writes are accepted while
 * the node simulates an outage; only replication traffic stops.
 */
public final class BoardService implements ReplicaEndpoint {
    private static final Logger log = Logger.getLogger(BoardService.class.getName());

    /** Longest accepted message, in characters after trimming. */
    public static final int MAX_CONTENT_LENGTH = 4096;

    private final NodeState state;
    private final LamportClock clock;
    private final MessageStore store;
    private final AuthGate auth;
    private final ReplicationManager replication;

    public BoardService(
            NodeState state,
            LamportClock clock,
            MessageStore store,
            AuthGate auth,
            ReplicationManager replication
    ) {
        this.state = Objects.requireNonNull(state, "state");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = Objects.requireNonNull(store, "store");
        this.auth = Objects.requireNonNull(auth, "auth");
        this.replication = Objects.requireNonNull(replication, "replication");
    }

    /**
     * Create a message on this node.
     *
     * @param author optional; when present it must be the authenticated user
     * @throws AuthorizationException   token missing/invalid or author mismatch; nothing is stored
     * @throws IllegalArgumentException empty or oversized content
     * @throws io.mural.storage.DuplicateMessageIdException if the generated id already exists
     * @throws io.mural.storage.StorageException            if the message could not be made durable
     */
    public Message post(String token, String author, String content) {
        String principal = auth.authenticate(token);
        if (author != null && !author.isBlank() && !author.equals(principal)) {
            throw new AuthorizationException("cannot post as " + author);
        }
        String text = normalizeContent(content);

        Message m = Message.create(principal, text, clock.next());
        store.insert(m);
        log.log(Level.FINE, "Stored {0} by {1}", new Object[]{m.id(), principal});

        replication.onLocalWrite(m);
        return m;
    }

    /** The whole local board in display order. */
    public List<Message> messages() {
        return store.orderedView();
    }

    public int size() {
        return store.size();
    }

    /**
     * Idempotent ingest of one replicated message.
     *
     * @return true if the message was not known before
     */
    public boolean ingest(Message message, String fromNode) {
        boolean added = store.merge(List.of(message)) == 1;
        if (added) {
            log.log(Level.FINE, "Ingested {0} from {1}", new Object[]{message.id(), fromNode});
        }
        return added;
    }

    /** Full local message set. */
    public Set<Message> snapshot() {
        return store.snapshot();
    }

    @Override
    public boolean acceptPush(Message message, String fromNode) {
        if (state.isOffline()) {
            throw new NodeOfflineException(state.nodeId());
        }
        return ingest(message, fromNode);
    }

    @Override
    public Set<Message> serveSnapshot(String fromNode) {
        if (state.isOffline()) {
            throw new NodeOfflineException(state.nodeId());
        }
        return snapshot();
    }

    static String normalizeContent(String content) {
        if (content == null) {
            throw new IllegalArgumentException("content required");
        }
        String text = content.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("content must not be empty");
        }
        if (text.length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("content longer than " + MAX_CONTENT_LENGTH + " characters");
        }
        return text;
    }
}
