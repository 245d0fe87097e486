package com.libragraph.weather.core.storage;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;

/**
 * Helper to write zip archives for testing, including ones the store would never produce.
 *
 * <p>Entries are written in the order added; repeated names are kept.
 */
public class TestZipBuilder {

    private final List<Entry> entries = new ArrayList<>();

    public record Entry(String path, byte[] data) {}

    public TestZipBuilder addFile(String path, String content) {
        entries.add(new Entry(path, content.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    public TestZipBuilder addFile(String path, byte[] data) {
        entries.add(new Entry(path, data));
        return this;
    }

    /**
     * Writes the archive to {@code path}, replacing any existing file.
     */
    public Path writeTo(Path path) {
        try {
            Files.deleteIfExists(path);
            try (ZipArchiveOutputStream out = new ZipArchiveOutputStream(path.toFile())) {
                for (Entry entry : entries) {
                    ZipArchiveEntry ze = new ZipArchiveEntry(entry.path());
                    ze.setMethod(ZipEntry.DEFLATED);
                    ze.setTime(1704067200000L); // 2024-01-01 00:00:00 UTC
                    out.putArchiveEntry(ze);
                    out.write(entry.data());
                    out.closeArchiveEntry();
                }
            }
            return path;
        } catch (IOException e) {
            throw new RuntimeException("Failed to build test zip " + path, e);
        }
    }
}
