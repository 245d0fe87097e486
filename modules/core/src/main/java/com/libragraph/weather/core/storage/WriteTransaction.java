package com.libragraph.weather.core.storage;

/**
 * Write side of a {@link BlobStore} transaction. Only valid inside the callback that
 * received it.
 */
public interface WriteTransaction {

    /**
     * Appends a blob.
     *
     * @throws BlobAlreadyExistsException if the key is already stored or was written
     *                                    earlier in this transaction
     * @throws StorageException           on I/O errors
     */
    void write(String key, byte[] content);

    /**
     * Number of blobs written so far in this transaction.
     */
    int written();
}
