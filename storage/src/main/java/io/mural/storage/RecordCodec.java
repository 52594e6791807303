// file: storage/src/main/java/io/mural/storage/RecordCodec.java
package io.mural.storage;

import io.mural.core.LogicalTimestamp;
import io.mural.core.Message;
import io.mural.core.MessageId;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for log records. One record holds one message.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x3A7B   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - originNode: int32 len + UTF-8 bytes
 *     - sequence:   int64
 *     - author:     int32 len + UTF-8 bytes
 *     - content:    int32 len + UTF-8 bytes
 *     - tsCounter:  int64
 *     - tsNode:     int32 len + UTF-8 bytes
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x3A7B;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Encode a message into header+payload bytes ready for append. */
    static byte[] encode(Message m) {
        byte[] payload = encodePayload(m);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static Message decode(byte[] payload) {
        try {
            ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
            String origin = readString(b);
            long sequence = b.getLong();
            String author = readString(b);
            String content = readString(b);
            long tsCounter = b.getLong();
            String tsNode = readString(b);
            return new Message(
                    new MessageId(origin, sequence),
                    author,
                    content,
                    new LogicalTimestamp(tsCounter, tsNode),
                    origin
            );
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("truncated record payload", e);
        }
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(Message m) {
        byte[] origin  = utf8(m.id().originNode());
        byte[] author  = utf8(m.author());
        byte[] content = utf8(m.content());
        byte[] tsNode  = utf8(m.timestamp().nodeId());

        int size = 0;
        size += 4 + origin.length;    // originNode
        size += 8;                    // sequence
        size += 4 + author.length;    // author
        size += 4 + content.length;   // content
        size += 8;                    // tsCounter
        size += 4 + tsNode.length;    // tsNode

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        writeBytes(b, origin);
        b.putLong(m.id().sequence());
        writeBytes(b, author);
        writeBytes(b, content);
        b.putLong(m.timestamp().counter());
        writeBytes(b, tsNode);
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // CRC32 fits in unsigned int; Java int is fine for compare
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length).put(data);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("bad string length " + len);
        }
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}
