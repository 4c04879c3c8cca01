package com.vesselintel.photos.output;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem-backed store. Keys map to paths relative to the root directory,
 * e.g. vessel-photos/IMO_9169031/123456.jpg.
 */
@Slf4j
public class LocalObjectStore implements ObjectStore {

    private final Path root;

    public LocalObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            // readers see either the previous object or the complete new one
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote {} bytes to {}", content.length, target);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + key + " under " + root, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path source = resolve(key);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(source));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + key + " under " + root, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(this::toKey)
                    .filter(key -> key.startsWith(prefix))
                    .filter(key -> !key.endsWith(".tmp"))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list " + prefix + " under " + root, e);
        }
    }

    @Override
    public void verifyAccess() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage root: " + root, e);
        }
        if (!Files.isWritable(root)) {
            throw new StorageException("Storage root is not writable: " + root);
        }
    }

    @Override
    public String describe() {
        return "file://" + root;
    }

    private Path resolve(String key) {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new StorageException("Key escapes storage root: " + key);
        }
        return resolved;
    }

    private String toKey(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
