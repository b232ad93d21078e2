package com.powerlevel.tracker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.powerlevel.tracker.exception.CacheWriteException;
import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.RepositoryContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Durable per-repository storage of the cache snapshot, one JSON file per repository hash.
 *
 * <p>Missing or unreadable files load as an empty snapshot; unreadable ones are moved aside first.
 * Writes go through a temporary file so the last good snapshot survives a crash mid-write.
 */
@Slf4j
@Service
public class CacheStoreService {

    static final String STATE_FILE = "state.json";

    @Value("${tracker.cache.dir:${user.home}/.cache/powerlevel}")
    private String cacheDir;

    private final ObjectMapper mapper;

    public CacheStoreService() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setCacheDir(String path) {
        this.cacheDir = path;
    }

    public Path cachePath(RepositoryContext context) {
        return Paths.get(cacheDir, context.getHash(), STATE_FILE);
    }

    public CacheSnapshot load(RepositoryContext context) {
        Path stateFile = cachePath(context);
        if (!Files.exists(stateFile)) {
            log.debug("No cache for {} at {}, starting cold", context.getSlug(), stateFile);
            return CacheSnapshot.empty();
        }

        try {
            CacheSnapshot snapshot = mapper.readValue(stateFile.toFile(), CacheSnapshot.class);
            return snapshot != null ? snapshot : CacheSnapshot.empty();
        } catch (IOException | RuntimeException e) {
            quarantine(stateFile, e);
            return CacheSnapshot.empty();
        }
    }

    /**
     * @throws CacheWriteException if the snapshot could not be written
     */
    public void save(RepositoryContext context, CacheSnapshot snapshot) {
        Path stateFile = cachePath(context);
        Path tempFile = stateFile.resolveSibling(STATE_FILE + ".tmp");
        try {
            Files.createDirectories(stateFile.getParent());
            mapper.writeValue(tempFile.toFile(), snapshot);
            try {
                Files.move(tempFile, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new CacheWriteException("Failed to save cache for " + context.getSlug() + " to " + stateFile, e);
        }
    }

    private void quarantine(Path stateFile, Exception cause) {
        Path aside = stateFile.resolveSibling(STATE_FILE + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(stateFile, aside, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Corrupted cache {} moved to {}, starting cold: {}", stateFile, aside, cause.getMessage());
        } catch (IOException e) {
            log.warn("Corrupted cache {} could not be moved aside ({}), starting cold: {}",
                stateFile, e.getMessage(), cause.getMessage());
        }
    }
}
