package io.mural.storage;

import io.mural.core.LamportClock;
import io.mural.core.LogicalTimestamp;
import io.mural.core.Message;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;

    private static Message msg(long counter, String text) {
        return Message.create("alice", text, new LogicalTimestamp(counter, "node-a"));
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() {
        // Prepare log and write two full records
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(RecordCodec.encode(msg(1, "m1")));
        wal.append(RecordCodec.encode(msg(2, "m2")));
        wal.close();

        // Third record is only partially written (simulate torn write)
        byte[] r3 = RecordCodec.encode(msg(3, "m3"));
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5); // header says "len" but payload is short
        } catch (Exception e) {
            fail(e);
        }

        var store = new DurableMessageStore(new FileWal(walDir, 1L << 60), new LamportClock("node-a"));

        assertEquals(2, store.size());
        assertEquals("m1", store.orderedView().get(0).content());
        assertEquals("m2", store.orderedView().get(1).content());
    }

    @Test
    void replay_stops_at_corrupted_crc() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encode(msg(1, "m1")));
        byte[] bad = RecordCodec.encode(msg(2, "m2"));
        bad[bad.length - 1] ^= 0x7F; // flip payload bits, CRC no longer matches
        wal.append(bad);
        wal.append(RecordCodec.encode(msg(3, "m3")));
        wal.close();

        var store = new DurableMessageStore(new FileWal(walDir, 1L << 60), new LamportClock("node-a"));

        assertEquals(1, store.size(), "replay keeps only the prefix before the corrupt record");
    }

    @Test
    void reader_walks_every_segment_after_rotation() {
        // Tiny threshold: every append rotates to a new segment.
        var clock = new LamportClock("node-a");
        var store = new DurableMessageStore(new FileWal(walDir, 1), clock);
        for (int i = 0; i < 5; i++) {
            store.insert(Message.create("alice", "m" + i, clock.next()));
        }

        var reopened = new DurableMessageStore(new FileWal(walDir, 1), new LamportClock("node-a"));

        assertEquals(5, reopened.size());
        assertTrue(Files.exists(walDir.resolve("00000005.log")));
    }

    @Test
    void write_after_torn_tail_survives_next_restart() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encode(msg(1, "m1")));
        wal.close();
        byte[] torn = RecordCodec.encode(msg(2, "lost"));
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(torn, 0, torn.length - 3);
        }

        // First restart: replay stops at the torn record, then a new local write is acknowledged
        var clock1 = new LamportClock("node-a");
        var wal1 = new FileWal(walDir, 1L << 60);
        var store1 = new DurableMessageStore(wal1, clock1);
        assertEquals(1, store1.size());
        var acked = Message.create("alice", "after crash", clock1.next());
        store1.insert(acked);
        wal1.close();

        // Second restart must still see it, and must not hand out its id again
        var clock2 = new LamportClock("node-a");
        var store2 = new DurableMessageStore(new FileWal(walDir, 1L << 60), clock2);

        assertEquals(2, store2.size());
        assertTrue(store2.contains(acked.id()));
        assertEquals(acked.id().sequence(), clock2.current());
        assertNotEquals(acked.id().sequence(), clock2.next().counter());
    }

    @Test
    void segments_after_damaged_record_are_set_aside_and_appends_resume_in_damaged_segment() throws Exception {
        var clock = new LamportClock("node-a");
        var wal = new FileWal(walDir, 1);
        var store = new DurableMessageStore(wal, clock);
        for (int i = 0; i < 3; i++) {
            store.insert(Message.create("alice", "m" + i, clock.next()));
        }
        wal.close();
        // Corrupt the payload of the only record in the second segment
        Path second = walDir.resolve("00000002.log");
        byte[] bytes = Files.readAllBytes(second);
        bytes[bytes.length - 1] ^= 0x7F;
        Files.write(second, bytes);

        var wal2 = new FileWal(walDir, 1L << 60);
        var store2 = new DurableMessageStore(wal2, new LamportClock("node-a"));
        assertEquals(1, store2.size());
        assertEquals(0, Files.size(second));
        assertFalse(Files.exists(walDir.resolve("00000003.log")));
        assertTrue(Files.exists(walDir.resolve("00000003.log" + FileWal.DAMAGED_SUFFIX)));

        store2.insert(msg(9, "resumed"));
        wal2.close();

        var reopened = new DurableMessageStore(new FileWal(walDir, 1L << 60), new LamportClock("node-a"));
        assertEquals(2, reopened.size());
        assertEquals("resumed", reopened.orderedView().get(1).content());
    }
}
