package com.docqa.rag.service.sync.blob;

import com.docqa.rag.config.KeyedLocks;
import com.docqa.rag.config.RagProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Optional;

/**
 * Blob store backed by a directory that several instances may share. Each file starts with an
 * 8-byte generation header. Writes and deletes hold an OS file lock next to the blob so that the
 * check and the rename are atomic across processes. The lock file is never removed.
 */
@Component
@Profile("!inmemory")
public class FileSystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);
    private static final int HEADER_BYTES = Long.BYTES;
    // Shared by every instance in the JVM, FileChannel.lock rejects overlapping locks within one process.
    private static final KeyedLocks<Path> LOCKS = new KeyedLocks<>();

    private final Path root;

    @Autowired
    public FileSystemBlobStore(RagProperties properties) {
        this(Path.of(properties.getSync().getBlobRoot()));
    }

    public FileSystemBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Optional<Blob> get(String key) {
        Path path = resolve(key);
        try {
            byte[] raw = Files.readAllBytes(path);
            if (raw.length < HEADER_BYTES) {
                throw new BlobStorageException("Blob " + key + " is truncated", null);
            }
            long generation = ByteBuffer.wrap(raw, 0, HEADER_BYTES).getLong();
            return Optional.of(new Blob(key, Arrays.copyOfRange(raw, HEADER_BYTES, raw.length), generation));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new BlobStorageException("Failed to read blob " + key, e);
        }
    }

    @Override
    public Optional<Long> head(String key) {
        try {
            return Optional.ofNullable(readGeneration(resolve(key)));
        } catch (IOException e) {
            throw new BlobStorageException("Failed to read blob generation " + key, e);
        }
    }

    @Override
    public long put(String key, byte[] content, Precondition precondition) {
        Path path = resolve(key);
        try (KeyedLocks.Held held = LOCKS.acquire(path)) {
            Files.createDirectories(path.getParent());
            try (FileChannel channel = openLockFile(path);
                 FileLock ignored = channel.lock()) {
                Long current = readGeneration(path);
                if (!precondition.isSatisfiedBy(current)) {
                    throw new PreconditionFailedException(key, precondition, current);
                }
                long generation = Math.max(current == null ? 1L : current + 1L, System.currentTimeMillis() * 1000L);
                Path temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
                try {
                    ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + content.length);
                    buffer.putLong(generation).put(content);
                    Files.write(temp, buffer.array());
                    move(temp, path);
                } finally {
                    Files.deleteIfExists(temp);
                }
                log.debug("Wrote blob {} generation {} ({} bytes)", key, generation, content.length);
                return generation;
            }
        } catch (IOException e) {
            throw new BlobStorageException("Failed to write blob " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        Path path = resolve(key);
        if (!Files.isDirectory(path.getParent())) {
            return false;
        }
        try (KeyedLocks.Held held = LOCKS.acquire(path);
             FileChannel channel = openLockFile(path);
             FileLock ignored = channel.lock()) {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new BlobStorageException("Failed to delete blob " + key, e);
        }
    }

    static int lockCount() {
        return LOCKS.size();
    }

    private static FileChannel openLockFile(Path path) throws IOException {
        return FileChannel.open(path.resolveSibling(path.getFileName() + ".lock"),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    }

    private Long readGeneration(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES);
            while (header.hasRemaining()) {
                if (channel.read(header) < 0) {
                    throw new IOException("Blob " + path + " is truncated");
                }
            }
            header.flip();
            return header.getLong();
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank() || key.contains("..") || key.startsWith("/") || key.contains("\\")) {
            throw new IllegalArgumentException("Invalid blob key: " + key);
        }
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Invalid blob key: " + key);
        }
        return path;
    }
}
