// file: storage/src/main/java/io/mural/storage/Wal.java
package io.mural.storage;

/**
 * Append-only log abstraction backing a node's message set.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - Failures are raised as {@link StorageException}; callers must not treat a
 *    record as written unless append() returned normally.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes, typically from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /**
     * Rotate log segment if configured thresholds are hit.
     * Called by the store after each write.
     */
    void rotateIfNeeded();

    /**
     * Open a sequential reader over the whole log.
     * Reader walks segments oldest first and stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the newest segment.
     */
    WalReader openReader();

    @Override
    void close();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at EOF, or
         *   - corruption/truncation is detected at the tail.
         */
        byte[] next();

        @Override
        void close();
    }
}
