// file: core/src/main/java/io/mural/core/MessageId.java
package io.mural.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Globally unique message identifier and merge key.
 * <p>
 * Composed of the node that created the message and a per-node sequence number
 * that only ever grows on that node. Since a node never hands out the same sequence
 * twice (including across restarts) an id is never reused.
 * <p>
 * Text form: {@code "<originNode>:<sequence>"}.
 */
public record MessageId(String originNode, long sequence) implements Comparable<MessageId> {

    private static final Comparator<MessageId> ORDER =
            Comparator.comparing(MessageId::originNode)
                    .thenComparingLong(MessageId::sequence);

    public MessageId {
        Objects.requireNonNull(originNode, "originNode");
        if (originNode.isBlank()) throw new IllegalArgumentException("originNode must not be blank");
        if (sequence <= 0) throw new IllegalArgumentException("sequence must be > 0, got " + sequence);
    }

    /**
     * Parse the text form produced by {@link #toString()}.
     * The node id may itself contain ':'; the sequence is everything after the last one.
     */
    public static MessageId parse(String text) {
        Objects.requireNonNull(text, "text");
        int sep = text.lastIndexOf(':');
        if (sep <= 0 || sep == text.length() - 1) {
            throw new IllegalArgumentException("malformed message id: " + text);
        }
        try {
            return new MessageId(text.substring(0, sep), Long.parseLong(text.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("malformed message id: " + text, e);
        }
    }

    @Override
    public int compareTo(MessageId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return originNode + ":" + sequence;
    }
}
