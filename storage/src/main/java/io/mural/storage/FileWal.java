// file: storage/src/main/java/io/mural/storage/FileWal.java
package io.mural.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;


/**
 * File-backed log that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - repairs the tail: the first damaged record (torn header/payload or bad
 *        CRC) and everything after it in that segment is truncated, and any later
 *        segments are renamed to "*.log.damaged" so replay no longer sees them,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - opens it for append.
 *    New records therefore always follow the last valid one and are visible to
 *    the next replay.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks every segment in name order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private static final String SUFFIX = ".log";
    static final String DAMAGED_SUFFIX = ".damaged";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StorageException("cannot create log dir " + dir, e); }
        repairTail();
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new StorageException("log append failed on " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(SUFFIX, ""));
            current = dir.resolve(segmentName(index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new StorageException("log rotation failed in " + dir, e); }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() {
        if (ch == null) return;
        try { ch.close(); } catch (IOException e) { throw new StorageException("log close failed", e); }
    }

    static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    /**
     * Cuts the log back to its longest valid prefix, the same prefix the reader
     * replays, so the next append lands where replay can reach it.
     */
    private void repairTail() {
        List<Path> segs = segments(dir);
        for (int i = 0; i < segs.size(); i++) {
            Path seg = segs.get(i);
            try (FileChannel c = FileChannel.open(seg, READ, WRITE)) {
                long size = c.size();
                long valid = validPrefix(c);
                if (valid == size) continue;
                log.log(Level.WARNING, "Damaged record in log segment {0} at offset {1}; truncating {2} trailing bytes",
                        new Object[]{seg, String.valueOf(valid), String.valueOf(size - valid)});
                c.truncate(valid);
                c.force(true);
            } catch (IOException e) {
                throw new StorageException("cannot repair log segment " + seg, e);
            }
            for (Path later : segs.subList(i + 1, segs.size())) {
                setAside(later);
            }
            return;
        }
    }

    private static void setAside(Path seg) {
        Path target = seg.resolveSibling(seg.getFileName() + DAMAGED_SUFFIX);
        log.log(Level.WARNING, "Setting aside log segment {0} after damaged record", seg);
        try {
            Files.move(seg, target);
        } catch (IOException e) {
            throw new StorageException("cannot set aside log segment " + seg, e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) { throw new StorageException("cannot open log segment " + current, e); }
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("cannot list log segments in " + dir, e);
        }
    }

    /** Byte offset just past the last valid record of the segment. */
    static long validPrefix(FileChannel c) throws IOException {
        long pos = 0;
        long size = c.size();
        while (pos < size) {
            byte[] payload = readRecord(c, pos);
            if (payload == null) break;
            pos += RecordCodec.HEADER_BYTES + (long) payload.length;
        }
        return pos;
    }

    /**
     * Reads the record starting at {@code pos}.
     *
     * @return the payload, or null if the header or payload is truncated or fails validation
     */
    private static byte[] readRecord(FileChannel c, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = c.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return null; // truncated header at tail, stop
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + (long) len > c.size()) return null; // truncated payload, stop
        ByteBuffer payload = ByteBuffer.allocate(len);
        int r2 = c.read(payload, pos + RecordCodec.HEADER_BYTES);
        if (r2 < len) return null;
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null; // bad tail, stop
        return bytes;
    }

    /**
     * Sequential reader for log segments used during recovery.
     * A damaged record ends the whole replay, including later segments, so the
     * replayed state is always a prefix of what was appended.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIndex = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null && !openNextSegment()) {
                        return null;
                    }
                    if (pos >= ch.size()) {
                        // clean end of this segment, continue with the next one
                        ch.close();
                        ch = null;
                        continue;
                    }
                    byte[] rec = readRecord(ch, pos);
                    if (rec == null) {
                        stopped = true;
                        return null;
                    }
                    pos += RecordCodec.HEADER_BYTES + (long) rec.length;
                    return rec;
                }
            } catch (IOException e) {
                throw new StorageException("log replay failed", e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segIndex++;
            if (segIndex >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segIndex), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() {
            if (ch == null) return;
            try { ch.close(); } catch (IOException e) { throw new StorageException("log reader close failed", e); }
        }
    }
}
