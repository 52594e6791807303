package io.mural.server.node;

/**
 * Raised by the replica endpoint when an inbound push or pull reaches a node that
 * is simulating an outage.
 */
public class NodeOfflineException extends RuntimeException {

    public NodeOfflineException(String nodeId) {
        super("node " + nodeId + " is offline (simulated)");
    }
}
