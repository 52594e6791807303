package io.mural.storage;

import io.mural.core.LamportClock;
import io.mural.core.LogicalTimestamp;
import io.mural.core.Message;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DurableMessageStoreTest {

    @TempDir Path dir;

    private static Message msg(String node, long counter) {
        return Message.create("alice", "hello from " + node + "#" + counter, new LogicalTimestamp(counter, node));
    }

    private DurableMessageStore open(String name) {
        return new DurableMessageStore(new FileWal(dir.resolve(name), 1L << 20), new LamportClock("node-a"));
    }

    private static Set<String> ids(MessageStore store) {
        Set<String> out = new HashSet<>();
        for (Message m : store.snapshot()) out.add(m.id().toString());
        return out;
    }

    @Test
    void insert_rejects_duplicate_id() {
        var store = open("s");
        var m = msg("node-a", 1);
        store.insert(m);

        var ex = assertThrows(DuplicateMessageIdException.class, () -> store.insert(m));
        assertEquals(m.id(), ex.id());
        assertEquals(1, store.size());
    }

    @Test
    void merge_twice_is_same_as_merge_once() {
        var store = open("s");
        List<Message> batch = List.of(msg("node-b", 1), msg("node-b", 2), msg("node-c", 1));

        assertEquals(3, store.merge(batch));
        Set<Message> afterFirst = store.snapshot();

        assertEquals(0, store.merge(batch));
        assertEquals(afterFirst, store.snapshot());
    }

    @Test
    void merge_order_and_grouping_do_not_matter() {
        List<Message> a = List.of(msg("node-b", 1), msg("node-b", 2), msg("node-c", 3));
        List<Message> b = List.of(msg("node-c", 3), msg("node-d", 1), msg("node-b", 5));
        List<Message> union = new ArrayList<>(a);
        union.addAll(b);

        var ab = open("ab");
        ab.merge(a);
        ab.merge(b);

        var ba = open("ba");
        ba.merge(b);
        ba.merge(a);

        var once = open("once");
        once.merge(union);

        assertEquals(ab.snapshot(), ba.snapshot());
        assertEquals(ab.snapshot(), once.snapshot());
        assertEquals(5, once.size(), "shared message node-c:3 appears once");
        assertEquals(ab.orderedView(), ba.orderedView());
    }

    @Test
    void merge_deduplicates_within_one_batch() {
        var store = open("s");
        var m = msg("node-b", 4);

        assertEquals(1, store.merge(List.of(m, m, m)));
        assertEquals(1, store.size());
    }

    @Test
    void merge_advances_clock_past_observed_counters() {
        var clock = new LamportClock("node-a");
        var store = new DurableMessageStore(new FileWal(dir.resolve("c"), 1L << 20), clock);

        store.merge(List.of(msg("node-b", 17)));

        assertEquals(18, clock.next().counter());
    }

    @Test
    void ordered_view_sorts_by_timestamp_then_id() {
        var store = open("s");
        store.merge(List.of(msg("node-c", 2), msg("node-b", 2), msg("node-a", 3), msg("node-c", 1)));

        List<String> got = store.orderedView().stream().map(m -> m.id().toString()).toList();
        assertEquals(List.of("node-c:1", "node-b:2", "node-c:2", "node-a:3"), got);
    }

    @Test
    void reload_restores_messages_and_clock() {
        var clock1 = new LamportClock("node-a");
        var store1 = new DurableMessageStore(new FileWal(dir.resolve("r"), 1L << 20), clock1);
        store1.insert(Message.create("alice", "one", clock1.next()));
        store1.insert(Message.create("alice", "two", clock1.next()));
        store1.merge(List.of(msg("node-b", 40)));

        // "Crash": drop reference; new instance recovers from disk
        var clock2 = new LamportClock("node-a");
        var store2 = new DurableMessageStore(new FileWal(dir.resolve("r"), 1L << 20), clock2);

        assertEquals(store1.snapshot(), store2.snapshot());
        assertEquals(40, clock2.current());
        // the next local id cannot collide with anything already stored
        var fresh = Message.create("alice", "three", clock2.next());
        assertFalse(store2.contains(fresh.id()));
        store2.insert(fresh);
        assertEquals(4, store2.size());
    }

    @Test
    void failed_append_leaves_store_unchanged() {
        var failing = new FailingWal();
        var store = new DurableMessageStore(failing, new LamportClock("node-a"));
        store.insert(msg("node-a", 1));

        failing.failAppends = true;

        assertThrows(StorageException.class, () -> store.insert(msg("node-a", 2)));
        assertThrows(StorageException.class, () -> store.merge(List.of(msg("node-b", 1))));
        assertEquals(Set.of("node-a:1"), ids(store));
    }

    /** In-memory log whose appends can be switched to fail. */
    private static final class FailingWal implements Wal {
        private final List<byte[]> records = new ArrayList<>();
        boolean failAppends;

        @Override
        public void append(byte[] serializedRecord) {
            if (failAppends) {
                throw new StorageException("disk full", new IOException("No space left on device"));
            }
            records.add(serializedRecord);
        }

        @Override
        public void rotateIfNeeded() {
        }

        @Override
        public WalReader openReader() {
            return new WalReader() {
                @Override
                public byte[] next() {
                    return null;
                }

                @Override
                public void close() {
                }
            };
        }

        @Override
        public void close() {
        }
    }
}
