package com.libragraph.weather.core.storage;

import java.nio.file.Path;

/**
 * Thrown when a read targets a blob that does not exist.
 */
public class BlobNotFoundException extends RuntimeException {

    private final Path archive;
    private final String key;

    public BlobNotFoundException(Path archive, String key) {
        super("Blob not found: archive=" + archive + " key=" + key);
        this.archive = archive;
        this.key = key;
    }

    public Path archive() {
        return archive;
    }

    public String key() {
        return key;
    }
}
