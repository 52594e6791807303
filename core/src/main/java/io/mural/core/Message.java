// file: core/src/main/java/io/mural/core/Message.java
package io.mural.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable board message.
 * <p>
 * Fields:
 *  - id:         merge key (origin node + per-node sequence).
 *  - author:     authenticated principal that wrote the message.
 *  - content:    text payload.
 *  - timestamp:  Lamport timestamp assigned at creation; drives display order.
 *  - originNode: node where the message was first created (diagnostics only).
 * <p>
 * Invariants:
 *  - A message is never edited after creation, so a given id maps to one value
 *    everywhere it appears. Merging two message sets is a plain union by id.
 *  - originNode always equals id.originNode().
 */
public record Message(
        MessageId id,
        String author,
        String content,
        LogicalTimestamp timestamp,
        String originNode
) {

    /**
     * Display order: logical timestamp ascending, ties broken by id.
     * Depends only on message contents, never on arrival order.
     */
    public static final Comparator<Message> DISPLAY_ORDER =
            Comparator.comparing(Message::timestamp).thenComparing(Message::id);

    public Message {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(originNode, "originNode");
        if (!originNode.equals(id.originNode())) {
            throw new IllegalArgumentException(
                    "originNode %s does not match id %s".formatted(originNode, id));
        }
    }

    /**
     * Create a message authored on {@code timestamp.nodeId()}.
     * The timestamp counter doubles as the per-node sequence number.
     */
    public static Message create(String author, String content, LogicalTimestamp timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        var id = new MessageId(timestamp.nodeId(), timestamp.counter());
        return new Message(id, author, content, timestamp, timestamp.nodeId());
    }
}
