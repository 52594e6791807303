package io.mural.server.dto;

import io.mural.server.peer.PeerStatus;

/** One entry of GET /admin/peers. */
public class PeerStatusDto {
    public String peerId;
    public String address;
    public boolean reachable;
    public int consecutiveFailures;

    public static PeerStatusDto from(PeerStatus p) {
        var dto = new PeerStatusDto();
        dto.peerId = p.peerId();
        dto.address = p.address();
        dto.reachable = p.reachable();
        dto.consecutiveFailures = p.consecutiveFailures();
        return dto;
    }
}
