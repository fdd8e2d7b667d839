// file: storage/src/main/java/io/revlite/storage/Wal.java
package io.revlite.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /** Rotate log segment if the size threshold is hit. Called after each batch. */
    void rotateIfNeeded();

    /**
     * Drop every record written so far and start an empty segment.
     * Only called once a snapshot covers everything in the log.
     */
    void reset();

    /**
     * Open a sequential reader over the WAL, oldest segment first. Stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the last segment.
     */
    WalReader openReader();

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null at the end
         * or at the first corrupt/truncated record.
         */
        byte[] next();

        @Override
        void close();
    }
}
