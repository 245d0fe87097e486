package com.libragraph.weather.core.storage;

/**
 * Aggregate statistics of an archive.
 *
 * @param entries        number of stored entries
 * @param entriesSize    sum of uncompressed entry sizes
 * @param compressedSize sum of compressed entry sizes
 * @param size           size of the archive file on disk
 */
public record ArchiveProperties(long entries, long entriesSize, long compressedSize, long size) {

    public static final ArchiveProperties EMPTY = new ArchiveProperties(0, 0, 0, 0);
}
