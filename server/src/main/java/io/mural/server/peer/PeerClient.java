// file: server/src/main/java/io/mural/server/peer/PeerClient.java
package io.mural.server.peer;

import io.mural.core.Message;

import java.time.Duration;
import java.util.List;

/**
 * Outbound side of the node-to-node replication API, bound to one peer.
 *
 * Implementations:
 *  - GrpcPeerClient talks to a remote node's MessageReplica service.
 *  - LocalPeerClient calls a ReplicaEndpoint in the same JVM (tests, demos).
 *
 * All methods are blocking and bounded by the given timeout.
 */
public interface PeerClient extends AutoCloseable {

    /** Node id of the peer this client talks to. */
    String peerId();

    /**
     * PushMessage: idempotent ingest on the peer.
     *
     * @return true if the peer did not have the message before
     */
    boolean push(Message message, Duration timeout) throws PeerUnreachableException;

    /** PullSnapshot: the peer's full message set. */
    List<Message> pullSnapshot(Duration timeout) throws PeerUnreachableException;

    @Override
    default void close() {
    }
}
