package com.libragraph.weather.core.storage;

import java.nio.file.Path;

public class BlobAlreadyExistsException extends StorageException {

    private final String key;

    public BlobAlreadyExistsException(Path archive, String key) {
        super("Blob already exists: archive=" + archive + " key=" + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
