package io.mural.server.replication;

import java.util.List;

/**
 * Result of one reconciliation round over all peers.
 * <p>
 * A round where some peers failed is a partial failure: the exchanges that did
 * succeed are kept, and the failed peers are simply tried again on the next
 * trigger. It is reported here and never thrown.
 *
 * @param skipReason why the round did not run, null if it ran
 */
public record ReconciliationReport(List<PeerSyncResult> peers, String skipReason) {

    public ReconciliationReport {
        peers = List.copyOf(peers);
    }

    public static ReconciliationReport of(List<PeerSyncResult> peers) {
        return new ReconciliationReport(peers, null);
    }

    public static ReconciliationReport skipped(String reason) {
        return new ReconciliationReport(List.of(), reason);
    }

    public boolean skipped() {
        return skipReason != null;
    }

    public int pulled() {
        int n = 0;
        for (PeerSyncResult r : peers) n += r.pulled();
        return n;
    }

    public int pushedBack() {
        int n = 0;
        for (PeerSyncResult r : peers) n += r.pushedBack();
        return n;
    }

    public List<String> failedPeers() {
        return peers.stream()
                .filter(r -> !r.success())
                .map(PeerSyncResult::peerId)
                .toList();
    }

    public boolean partialFailure() {
        return !failedPeers().isEmpty();
    }
}
