// file: storage/src/main/java/io/mural/storage/DurableMessageStore.java
package io.mural.storage;

import io.mural.core.LamportClock;
import io.mural.core.Message;
import io.mural.core.MessageId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Log-backed message store.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: id -> Message, plus a display-ordered index.
 *  - On write:
 *      1) Serialize the message to a log record.
 *      2) Append+fsync to the log.
 *      3) Apply to memory.
 *      4) Rotate log segment if needed.
 *    A failed append leaves memory untouched.
 *  - On startup:
 *      1) Replay log records, applying each id once.
 *      2) Feed every replayed counter to the Lamport clock so that ids and
 *         timestamps issued after a restart stay monotonic.
 * <p>
 * Concurrency: writers are serialized by the write lock; readers share the read
 * lock and always see a fully applied merge.
 */
public class DurableMessageStore implements MessageStore {
    private static final Logger log = Logger.getLogger(DurableMessageStore.class.getName());

    private final Map<MessageId, Message> byId = new HashMap<>();
    private final TreeSet<Message> ordered = new TreeSet<>(Message.DISPLAY_ORDER);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Wal wal;
    private final LamportClock clock;

    public DurableMessageStore(Wal wal, LamportClock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    @Override
    public void insert(Message message) {
        Objects.requireNonNull(message, "message");
        lock.writeLock().lock();
        try {
            if (byId.containsKey(message.id())) {
                throw new DuplicateMessageIdException(message.id());
            }
            persist(message);
            apply(message);
            wal.rotateIfNeeded();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int merge(Collection<Message> incoming) {
        Objects.requireNonNull(incoming, "incoming");
        if (incoming.isEmpty()) {
            return 0;
        }
        int added = 0;
        lock.writeLock().lock();
        try {
            for (Message m : incoming) {
                // Lamport advancement applies to everything we see, new or not.
                clock.observe(m.timestamp().counter());
                if (byId.containsKey(m.id())) {
                    continue;
                }
                persist(m);
                apply(m);
                added++;
            }
            if (added > 0) {
                wal.rotateIfNeeded();
            }
        } finally {
            lock.writeLock().unlock();
        }
        return added;
    }

    @Override
    public Set<Message> snapshot() {
        lock.readLock().lock();
        try {
            return Set.copyOf(byId.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Message> orderedView() {
        lock.readLock().lock();
        try {
            return List.copyOf(ordered);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(MessageId id) {
        lock.readLock().lock();
        try {
            return byId.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return byId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Recovery procedure called from constructor: replay the log in order,
     * applying each id at most once. A torn tail simply ends the replay.
     */
    private void recover() {
        int replayed = 0;
        int duplicates = 0;
        List<Message> loaded = new ArrayList<>();
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                loaded.add(RecordCodec.decode(payload));
            }
        } catch (IllegalArgumentException e) {
            throw new StorageException("unreadable log record during recovery", e);
        }

        lock.writeLock().lock();
        try {
            for (Message m : loaded) {
                clock.observe(m.timestamp().counter());
                if (byId.containsKey(m.id())) {
                    duplicates++;
                    continue;
                }
                apply(m);
                replayed++;
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (replayed > 0 || duplicates > 0) {
            log.log(Level.INFO, "Recovered {0} messages from log ({1} duplicate records skipped), clock at {2}",
                    new Object[]{replayed, duplicates, clock.current()});
        }
    }

    private void persist(Message m) {
        wal.append(RecordCodec.encode(m));
    }

    private void apply(Message m) {
        byId.put(m.id(), m);
        ordered.add(m);
    }
}
