package io.mural.server.dto;

import io.mural.server.replication.PeerSyncResult;
import io.mural.server.replication.ReconciliationReport;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON response for POST /admin/reconcile and POST /admin/online.
 * For /admin/online the round runs in the background and only "started" is set.
 */
public class ReconcileResponse {
    public String mode;
    public boolean started;
    public String skipped;
    public int pulled;
    public int pushedBack;
    public boolean partialFailure;
    public List<String> failedPeers;
    public List<PeerResult> peers;

    public static class PeerResult {
        public String peerId;
        public boolean success;
        public int pulled;
        public int pushedBack;
        public String error;
    }

    public static ReconcileResponse from(ReconciliationReport r, String mode) {
        var dto = new ReconcileResponse();
        dto.mode = mode;
        dto.started = !r.skipped();
        dto.skipped = r.skipReason();
        dto.pulled = r.pulled();
        dto.pushedBack = r.pushedBack();
        dto.partialFailure = r.partialFailure();
        dto.failedPeers = r.failedPeers();
        dto.peers = new ArrayList<>(r.peers().size());
        for (PeerSyncResult p : r.peers()) {
            var pr = new PeerResult();
            pr.peerId = p.peerId();
            pr.success = p.success();
            pr.pulled = p.pulled();
            pr.pushedBack = p.pushedBack();
            pr.error = p.error();
            dto.peers.add(pr);
        }
        return dto;
    }
}
