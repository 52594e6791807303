package io.mural.server.replication;

/**
 * Outcome of one reconciliation exchange with one peer.
 *
 * @param pulled     messages learned from the peer
 * @param pushedBack local messages the peer lacked and was sent
 * @param error      failure description, null on success
 */
public record PeerSyncResult(
        String peerId,
        boolean success,
        int pulled,
        int pushedBack,
        String error
) {

    static PeerSyncResult ok(String peerId, int pulled, int pushedBack) {
        return new PeerSyncResult(peerId, true, pulled, pushedBack, null);
    }

    static PeerSyncResult failed(String peerId, int pulled, int pushedBack, String error) {
        return new PeerSyncResult(peerId, false, pulled, pushedBack, error);
    }
}
