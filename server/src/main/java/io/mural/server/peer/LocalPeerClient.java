// file: server/src/main/java/io/mural/server/peer/LocalPeerClient.java
package io.mural.server.peer;

import io.mural.core.Message;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * In-process PeerClient that directly invokes another node's ReplicaEndpoint.
 * <p>
 * Every failure of the target (offline, storage error, not yet wired) is turned
 * into {@link PeerUnreachableException}, the same way a transport error would be.
 * The endpoint is resolved lazily so nodes that refer to each other can be built
 * in any order.
 */
public final class LocalPeerClient implements PeerClient {

    private final String peerId;
    private final String localNodeId;
    private final Supplier<ReplicaEndpoint> target;

    public LocalPeerClient(String peerId, String localNodeId, Supplier<ReplicaEndpoint> target) {
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        this.target = Objects.requireNonNull(target, "target");
    }

    @Override
    public String peerId() {
        return peerId;
    }

    @Override
    public boolean push(Message message, Duration timeout) throws PeerUnreachableException {
        try {
            return endpoint().acceptPush(message, localNodeId);
        } catch (RuntimeException e) {
            throw new PeerUnreachableException(peerId, "push to " + peerId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Message> pullSnapshot(Duration timeout) throws PeerUnreachableException {
        try {
            return List.copyOf(endpoint().serveSnapshot(localNodeId));
        } catch (RuntimeException e) {
            throw new PeerUnreachableException(peerId, "pull from " + peerId + " failed: " + e.getMessage(), e);
        }
    }

    private ReplicaEndpoint endpoint() {
        ReplicaEndpoint ep = target.get();
        if (ep == null) {
            throw new IllegalStateException("no endpoint bound for " + peerId);
        }
        return ep;
    }
}
