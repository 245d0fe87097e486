package com.libragraph.weather.core.storage;

import java.nio.file.Path;

/**
 * Thrown at open when an archive violates the append-only format, e.g. a member name
 * appears twice. The store is unusable until the archive is repaired by hand.
 */
public class CorruptArchiveException extends StorageException {

    private final Path archive;

    public CorruptArchiveException(Path archive, String detail) {
        super("Corrupt archive " + archive + ": " + detail);
        this.archive = archive;
    }

    public Path archive() {
        return archive;
    }
}
