package com.vibeforge.core.storage;

import com.vibeforge.config.VibeForgeSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * PayloadStorage: root-confined file I/O for code payloads, audit reports and indexes.
 *
 * Every path is resolved against the store root and rejected if it escapes it.
 * Writes go through a temp file + atomic move so a crash never leaves a
 * half-written index behind.
 */
@Component
public class PayloadStorage {

    private static final Logger log = LoggerFactory.getLogger(PayloadStorage.class);

    private final Path root;
    private final long maxPayloadBytes;

    public PayloadStorage(VibeForgeSettings settings) {
        this.root            = settings.getStoreRoot();
        this.maxPayloadBytes = settings.getMaxPayloadBytes();
        try {
            if (!Files.exists(root)) {
                Files.createDirectories(root);
                log.info("[PayloadStorage] Created store root: {}", root);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize store root: " + root, e);
        }
        log.info("[PayloadStorage] Store root: {}", root);
    }

    public Path getRoot() {
        return root;
    }

    // ================================================================
    // Read / write
    // ================================================================

    public String read(String relativePath) throws StorageException {
        Path target = resolveSafePath(relativePath);
        try {
            long size = Files.size(target);
            if (size > maxPayloadBytes)
                throw new StorageException("Payload too large: " + relativePath + " (" + size + " bytes)");
            return Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read payload: " + relativePath, e);
        }
    }

    public void write(String relativePath, String content) throws StorageException {
        Path target = resolveSafePath(relativePath);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > maxPayloadBytes)
            throw new StorageException("Payload too large: " + relativePath + " (" + bytes.length + " bytes)");
        try {
            Path parent = target.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("[PayloadStorage] Wrote {} bytes to {}", bytes.length, relativePath);
        } catch (IOException e) {
            throw new StorageException("Failed to write payload: " + relativePath, e);
        }
    }

    public boolean exists(String relativePath) {
        try { return Files.isRegularFile(resolveSafePath(relativePath)); }
        catch (StorageException e) { return false; }
    }

    /** @return true if a file was removed */
    public boolean delete(String relativePath) throws StorageException {
        Path target = resolveSafePath(relativePath);
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new StorageException("Failed to delete payload: " + relativePath, e);
        }
    }

    /** File names (not paths) directly under {@code relativeDir}; empty if the directory is absent. */
    public List<String> list(String relativeDir) throws StorageException {
        Path dir = resolveSafePath(relativeDir);
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(Files::isRegularFile)
                        .map(p -> p.getFileName().toString())
                        .filter(name -> !name.endsWith(".tmp"))
                        .sorted()
                        .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list directory: " + relativeDir, e);
        }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Path resolveSafePath(String relativePath) throws StorageException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new StorageException("Path cannot be empty");
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root))
            throw new StorageException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }

    public static class StorageException extends Exception {
        public StorageException(String message)                  { super(message); }
        public StorageException(String message, Throwable cause) { super(message, cause); }
    }
}
