package io.mural.server.replica;

import io.mural.core.LogicalTimestamp;
import io.mural.core.Message;
import io.mural.core.MessageId;

/**
 * Conversion between core messages and their wire form on the replica API.
 * fromProto() validates through the core constructors, so a malformed record
 * surfaces as IllegalArgumentException.
 */
public final class ReplicaMessages {

    private ReplicaMessages() {
    }

    public static MessageReplicaProto.MessageRecord toProto(Message m) {
        return MessageReplicaProto.MessageRecord.newBuilder()
                .setOriginNode(m.id().originNode())
                .setSequence(m.id().sequence())
                .setAuthor(m.author())
                .setContent(m.content())
                .setClockCounter(m.timestamp().counter())
                .setClockNode(m.timestamp().nodeId())
                .build();
    }

    public static Message fromProto(MessageReplicaProto.MessageRecord r) {
        return new Message(
                new MessageId(r.getOriginNode(), r.getSequence()),
                r.getAuthor(),
                r.getContent(),
                new LogicalTimestamp(r.getClockCounter(), r.getClockNode()),
                r.getOriginNode()
        );
    }
}
