package io.mural.server.peer;

/**
 * A call to a peer failed: timeout, refused connection, peer offline or an error
 * status. Always transient from the caller's point of view; it is retried or
 * left to the next reconciliation round and never reaches a board client.
 */
public class PeerUnreachableException extends Exception {

    private final String peerId;

    public PeerUnreachableException(String peerId, String message, Throwable cause) {
        super(message, cause);
        this.peerId = peerId;
    }

    public String peerId() {
        return peerId;
    }
}
