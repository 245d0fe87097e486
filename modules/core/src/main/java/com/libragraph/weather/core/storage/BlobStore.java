package com.libragraph.weather.core.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Append-only key to bytes storage backed by a single file.
 *
 * <p>Blobs are write-once: a key is never overwritten or deleted once committed,
 * which lets implementations cache reads indefinitely.
 *
 * <p>Writes only happen inside a transaction. If the callback completes normally the
 * writes are committed; if it throws, the store is restored to its state before the
 * transaction and the exception is rethrown unchanged.
 */
public interface BlobStore {

    /**
     * The file backing this store.
     */
    Path path();

    /**
     * Checks whether a committed blob exists.
     */
    boolean exists(String key);

    /**
     * Lists committed keys in storage order.
     */
    List<String> keys();

    /**
     * Reads a blob.
     *
     * @throws BlobNotFoundException if the blob does not exist
     * @throws StorageException      on I/O errors
     */
    byte[] read(String key);

    /**
     * Opens a reader that keeps the underlying file open across many reads.
     */
    Reader reader();

    /**
     * Runs the callback in a write transaction and returns its result.
     *
     * @throws IllegalStateException if another write transaction is active on the same file
     * @throws StorageException      on I/O errors, after rolling back
     */
    <R, X extends Exception> R inTransaction(TransactionCallback<R, X> callback) throws X;

    /**
     * Runs the consumer in a write transaction.
     */
    default <X extends Exception> void useTransaction(TransactionConsumer<X> consumer) throws X {
        this.<Void, X>inTransaction(tx -> {
            consumer.useTransaction(tx);
            return null;
        });
    }

    /**
     * Scans the whole store and aggregates entry statistics.
     */
    ArchiveProperties properties();

    /**
     * Drops cached blob content.
     */
    void clearCache();

    /**
     * Batch reader over a store. Reads share the store's cache.
     */
    interface Reader extends AutoCloseable {

        byte[] read(String key);

        @Override
        void close();
    }
}
