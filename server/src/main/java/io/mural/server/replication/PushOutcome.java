package io.mural.server.replication;

import io.mural.core.MessageId;

/**
 * Final result of pushing one message to one peer.
 *
 * @param attempts  network attempts actually made (0 when skipped)
 * @param lastError description of the last failure, null when delivered
 */
public record PushOutcome(
        String peerId,
        MessageId messageId,
        Status status,
        int attempts,
        String lastError
) {

    public enum Status {
        /** The peer acknowledged the message (new or already known). */
        DELIVERED,
        /** Every attempt failed, or the node went offline between attempts. */
        ABANDONED,
        /** The node was offline when the write happened; nothing was sent. */
        SKIPPED_OFFLINE,
        /** The peer was marked unreachable; reconciliation will carry the message. */
        SKIPPED_UNREACHABLE
    }

    static PushOutcome skipped(String peerId, MessageId id, Status status) {
        return new PushOutcome(peerId, id, status, 0, null);
    }
}
