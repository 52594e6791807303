package io.mural.server.peer;

import io.mural.core.Message;

import java.util.Set;

/**
 * Inbound side of the replication API: what a node does when a peer pushes to
 * it or pulls from it. Transport adapters (gRPC service, in-process client)
 * delegate here.
 */
public interface ReplicaEndpoint {

    /**
     * Ingest a pushed message; receiving a known id again changes nothing.
     *
     * @return true if the message was new
     * @throws io.mural.server.node.NodeOfflineException while simulating an outage
     */
    boolean acceptPush(Message message, String fromNode);

    /**
     * @return the full local message set
     * @throws io.mural.server.node.NodeOfflineException while simulating an outage
     */
    Set<Message> serveSnapshot(String fromNode);
}
