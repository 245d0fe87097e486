package com.libragraph.weather.core.storage;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.ZipEntry;

/**
 * Zip-backed {@link BlobStore}.
 *
 * <p>Each blob is a deflated zip entry named by its key. A write transaction first
 * copies the archive to {@code {archive}.bck}, rewrites the archive from that copy
 * and appends the new entries. Commit deletes the backup; rollback moves the backup
 * back over the archive. The backup never outlives the transaction, so a backup found
 * at open means the process died mid-write and the archive is restored from it.
 *
 * <p>Only one write transaction per archive may be active in the JVM. Reads need no
 * lock but are not consistent with a concurrent writer; callers serialize those.
 */
public class ArchiveBlobStore implements BlobStore {

    private static final Logger log = Logger.getLogger(ArchiveBlobStore.class);

    public static final String BACKUP_SUFFIX = ".bck";

    private static final Set<Path> ACTIVE_WRITERS = ConcurrentHashMap.newKeySet();

    private final Path archivePath;
    private final Path backupPath;
    private final Set<String> members;
    private final Map<String, byte[]> cache = new ConcurrentHashMap<>();

    private ArchiveBlobStore(Path archivePath, Set<String> members) {
        this.archivePath = archivePath;
        this.backupPath = backupPathFor(archivePath);
        this.members = Collections.synchronizedSet(members);
    }

    /**
     * Opens the archive, creating an empty one if it does not exist.
     *
     * @throws CorruptArchiveException if a member name appears more than once
     * @throws StorageException        if the archive cannot be read or created
     */
    public static ArchiveBlobStore open(Path archivePath) {
        Objects.requireNonNull(archivePath, "archivePath cannot be null");
        Path path = archivePath.toAbsolutePath().normalize();
        Path backup = backupPathFor(path);
        try {
            if (Files.exists(backup)) {
                log.warnf("Found %s from an interrupted write, restoring %s", backup, path);
                replace(backup, path);
            }
            if (!Files.exists(path)) {
                log.warnf("%s not found, creating...", path);
                createEmpty(path);
            }
            return new ArchiveBlobStore(path, scanMembers(path));
        } catch (IOException e) {
            throw new StorageException("Failed to open archive: " + path, e);
        }
    }

    public static Path backupPathFor(Path archivePath) {
        return archivePath.resolveSibling(archivePath.getFileName() + BACKUP_SUFFIX);
    }

    @Override
    public Path path() {
        return archivePath;
    }

    public Path backupPath() {
        return backupPath;
    }

    @Override
    public boolean exists(String key) {
        return members.contains(key);
    }

    @Override
    public List<String> keys() {
        synchronized (members) {
            return List.copyOf(members);
        }
    }

    @Override
    public byte[] read(String key) {
        try (Reader reader = reader()) {
            return reader.read(key);
        }
    }

    @Override
    public Reader reader() {
        return new ArchiveReader();
    }

    @Override
    public <R, X extends Exception> R inTransaction(TransactionCallback<R, X> callback) throws X {
        Objects.requireNonNull(callback, "callback cannot be null");
        if (!ACTIVE_WRITERS.add(archivePath)) {
            throw new IllegalStateException("A write transaction is already active on " + archivePath);
        }
        try {
            ArchiveTransaction tx = new ArchiveTransaction();
            try {
                tx.begin();
                R result = callback.withTransaction(tx);
                tx.commit();
                return result;
            } catch (Throwable t) {
                tx.rollback(t);
                throw t;
            }
        } finally {
            ACTIVE_WRITERS.remove(archivePath);
        }
    }

    @Override
    public ArchiveProperties properties() {
        long entries = 0;
        long entriesSize = 0;
        long compressedSize = 0;
        try (ZipFile zip = openZip(archivePath)) {
            Enumeration<ZipArchiveEntry> all = zip.getEntries();
            while (all.hasMoreElements()) {
                ZipArchiveEntry entry = all.nextElement();
                entries++;
                entriesSize += Math.max(entry.getSize(), 0);
                compressedSize += Math.max(entry.getCompressedSize(), 0);
            }
            return new ArchiveProperties(entries, entriesSize, compressedSize, Files.size(archivePath));
        } catch (IOException e) {
            throw new StorageException("Failed to read archive properties: " + archivePath, e);
        }
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    @Override
    public String toString() {
        return "ArchiveBlobStore[" + archivePath + "]";
    }

    // -- internals --

    private static ZipFile openZip(Path path) throws IOException {
        return ZipFile.builder().setPath(path).get();
    }

    private static void createEmpty(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (ZipArchiveOutputStream out = new ZipArchiveOutputStream(path.toFile())) {
            out.finish();
        }
    }

    private static Set<String> scanMembers(Path path) throws IOException {
        Set<String> names = new LinkedHashSet<>();
        try (ZipFile zip = openZip(path)) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                String name = entries.nextElement().getName();
                if (!names.add(name)) {
                    throw new CorruptArchiveException(path, "duplicate entry '" + name + "'");
                }
            }
        }
        return names;
    }

    /**
     * Moves {@code source} over {@code target}, atomically when the file system allows it.
     * Both live in the same directory.
     */
    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void closeQuietly(Closeable closeable, Throwable primary) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    private byte[] cached(String key) {
        byte[] content = cache.get(key);
        if (content != null) {
            log.tracef("Cache hit for %s", key);
        }
        return content;
    }

    private final class ArchiveReader implements Reader {

        private ZipFile zip;

        @Override
        public byte[] read(String key) {
            Objects.requireNonNull(key, "key cannot be null");
            byte[] content = cached(key);
            if (content == null) {
                if (!members.contains(key)) {
                    throw new BlobNotFoundException(archivePath, key);
                }
                content = load(key);
                cache.put(key, content);
            }
            return content.clone();
        }

        private byte[] load(String key) {
            try {
                if (zip == null) {
                    zip = openZip(archivePath);
                }
                ZipArchiveEntry entry = zip.getEntry(key);
                if (entry == null) {
                    throw new BlobNotFoundException(archivePath, key);
                }
                try (InputStream in = zip.getInputStream(entry)) {
                    return in.readAllBytes();
                }
            } catch (IOException e) {
                throw new StorageException("Failed to read blob: " + key, e);
            }
        }

        @Override
        public void close() {
            if (zip != null) {
                try {
                    zip.close();
                } catch (IOException e) {
                    throw new StorageException("Failed to close archive: " + archivePath, e);
                } finally {
                    zip = null;
                }
            }
        }
    }

    private final class ArchiveTransaction implements WriteTransaction {

        private final Set<String> pending = new HashSet<>();
        private final List<String> order = new ArrayList<>();
        private boolean backupTaken;
        private boolean active;
        private ZipFile source;
        private ZipArchiveOutputStream out;

        void begin() {
            try {
                Files.copy(archivePath, backupPath,
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                backupTaken = true;

                source = openZip(backupPath);
                refreshMembers(source);
                out = new ZipArchiveOutputStream(archivePath.toFile());
                out.setEncoding("UTF-8");
                source.copyRawEntries(out, entry -> true);
                active = true;
            } catch (IOException e) {
                throw new StorageException("Failed to begin write transaction on " + archivePath, e);
            }
        }

        /**
         * Another store on the same file may have committed since this one was opened.
         */
        private void refreshMembers(ZipFile zip) {
            Set<String> committed = new LinkedHashSet<>();
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                committed.add(entries.nextElement().getName());
            }
            synchronized (members) {
                if (!members.equals(committed)) {
                    log.debugf("%s changed since it was opened, reloading %d entries", archivePath, committed.size());
                    members.clear();
                    members.addAll(committed);
                }
            }
        }

        @Override
        public void write(String key, byte[] content) {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(content, "content cannot be null");
            if (!active) {
                throw new IllegalStateException("Write transaction on " + archivePath + " is not active");
            }
            if (members.contains(key) || pending.contains(key)) {
                throw new BlobAlreadyExistsException(archivePath, key);
            }

            ZipArchiveEntry entry = new ZipArchiveEntry(key);
            entry.setMethod(ZipEntry.DEFLATED);
            entry.setTime(System.currentTimeMillis());
            try {
                out.putArchiveEntry(entry);
                out.write(content);
                out.closeArchiveEntry();
            } catch (IOException e) {
                throw new StorageException("Failed to write blob: " + key, e);
            }
            pending.add(key);
            order.add(key);
        }

        @Override
        public int written() {
            return order.size();
        }

        void commit() {
            active = false;
            try {
                out.finish();
                out.close();
                out = null;
                source.close();
                source = null;
                Files.delete(backupPath);
                backupTaken = false;
            } catch (IOException e) {
                throw new StorageException("Failed to commit write transaction on " + archivePath, e);
            }
            members.addAll(order);
            log.debugf("Committed %d blob(s) to %s", order.size(), archivePath);
        }

        void rollback(Throwable cause) {
            active = false;
            closeQuietly(out, cause);
            closeQuietly(source, cause);
            out = null;
            source = null;
            try {
                if (backupTaken) {
                    replace(backupPath, archivePath);
                    backupTaken = false;
                    log.warnf("Rolled back %d blob(s) on %s: %s", order.size(), archivePath, cause.toString());
                } else {
                    Files.deleteIfExists(backupPath);
                }
            } catch (IOException e) {
                cause.addSuppressed(e);
                log.errorf(e, "Failed to restore %s from %s", archivePath, backupPath);
            }
        }
    }
}
