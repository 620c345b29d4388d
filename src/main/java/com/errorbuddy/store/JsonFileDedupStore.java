package com.errorbuddy.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Signature store persisted as a single JSON object on disk, so tracked
 * errors survive a restart.
 * <p>
 * Reads are served from memory. Every mutation rewrites the file through a
 * temporary sibling and an atomic move, so a crash never leaves a torn file.
 */
@Slf4j
public class JsonFileDedupStore implements DedupStore {

    private static final TypeReference<Map<String, Long>> MAP_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, Long> tracked;

    public JsonFileDedupStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.tracked = load();
    }

    @Override
    public synchronized Optional<Long> get(String signature) {
        return Optional.ofNullable(tracked.get(signature));
    }

    @Override
    public synchronized void set(String signature, long reportedAtEpochSeconds) {
        tracked.put(signature, reportedAtEpochSeconds);
        save();
    }

    @Override
    public synchronized Map<String, Long> getAll() {
        return new HashMap<>(tracked);
    }

    @Override
    public synchronized void delete(String signature) {
        if (tracked.remove(signature) != null) {
            save();
        }
    }

    @Override
    public synchronized void deleteAll() {
        tracked.clear();
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StoreException("Failed to delete " + file, e);
        }
    }

    @Override
    public synchronized void deleteAll(Collection<String> signatures) {
        if (tracked.keySet().removeAll(signatures)) {
            save();
        }
    }

    @Override
    public synchronized int size() {
        return tracked.size();
    }

    @Override
    public String getStoreType() {
        return "json-file";
    }

    private Map<String, Long> load() {
        if (!Files.exists(file)) {
            return new HashMap<>();
        }
        try {
            Map<String, Long> loaded = objectMapper.readValue(file.toFile(), MAP_TYPE);
            log.info("Loaded {} tracked error signatures from {}", loaded.size(), file);
            return new HashMap<>(loaded);
        } catch (IOException e) {
            // A corrupt file only costs us some duplicate emails
            log.warn("Ignoring unreadable dedup store {}: {}", file, e.getMessage());
            return new HashMap<>();
        }
    }

    private void save() {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), tracked);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Failed to write " + file, e);
        }
    }
}
