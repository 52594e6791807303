package io.mural.server.peer;

/**
 * Immutable view of one registry entry at a point in time.
 *
 * @param peerId              configured node id of the peer
 * @param address             "host:port" of the peer's replica endpoint
 * @param reachable           current belief about reachability
 * @param consecutiveFailures failed network attempts since the last success
 */
public record PeerStatus(
        String peerId,
        String address,
        boolean reachable,
        int consecutiveFailures
) {}
