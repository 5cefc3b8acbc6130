// file: storage/src/main/java/io/dripline/storage/Wal.java
package io.dripline.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param serializedRecord header+payload bytes from MutationCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /**
     * Start a new segment if the current one reached its size threshold.
     * Called by the store after each commit.
     */
    void rotateIfNeeded();

    /**
     * Start a new segment and delete every earlier one.
     * Call only after a durable snapshot covers every record appended so far.
     */
    void checkpoint();

    /**
     * Open a sequential reader over every segment, oldest first.
     * Stops at the first corrupt header, truncated payload, or end of log.
     */
    WalReader openReader();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (without header), or null at the end of
         *         the log or at the first corrupt/truncated record
         */
        byte[] next();

        @Override
        void close();
    }

    @Override
    void close();
}
