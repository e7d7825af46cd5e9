package com.tony.propsAnalytics.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Un document JSON par clé. Écriture via fichier temporaire + move atomique.
 */
@Slf4j
public class JsonFileCacheStore implements CacheStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    // Écritures concurrentes autorisées entre elles, exclusives avec la purge
    private final ReadWriteLock purgeLock = new ReentrantReadWriteLock();

    public JsonFileCacheStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Impossible de créer le répertoire de cache " + directory, e);
        }
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        return read(fileFor(key)).filter(entry -> key.equals(entry.key()));
    }

    @Override
    public void put(CacheEntry entry) {
        purgeLock.readLock().lock();
        try {
            Path target = fileFor(entry.key());
            Path tmp = Files.createTempFile(directory, "entry-", ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), entry);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture du cache impossible pour " + entry.key(), e);
        } finally {
            purgeLock.readLock().unlock();
        }
    }

    @Override
    public int removeIf(Predicate<CacheEntry> predicate) {
        purgeLock.writeLock().lock();
        try {
            int removed = 0;
            for (Path file : listEntries()) {
                Optional<CacheEntry> entry = read(file);
                // Fichier illisible : on le supprime aussi
                if (entry.isEmpty() || predicate.test(entry.get())) {
                    if (Files.deleteIfExists(file)) removed++;
                }
            }
            return removed;
        } catch (IOException e) {
            throw new UncheckedIOException("Purge du cache impossible", e);
        } finally {
            purgeLock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        return listEntries().size();
    }

    private Optional<CacheEntry> read(Path file) {
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CacheEntry.class));
        } catch (NoSuchFileException | java.io.FileNotFoundException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("⚠️ Entrée de cache illisible {} : {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<Path> listEntries() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture du répertoire de cache impossible", e);
        }
    }

    Path fileFor(CacheKey key) {
        String raw = key.asString();
        StringBuilder safe = new StringBuilder();
        for (char c : raw.toCharArray()) {
            safe.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' ? c : '_');
        }
        // Le hash évite les collisions après assainissement (PTS+REB vs PTS_REB)
        return directory.resolve(safe + "-" + Integer.toHexString(raw.hashCode()) + SUFFIX);
    }
}
