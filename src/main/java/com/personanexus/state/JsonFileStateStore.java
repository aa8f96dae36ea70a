/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.personanexus.utils.LoggerUtil;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * State store keeping one JSON file per key under a directory.
 *
 * <p>Writes go to a temp file in the same directory and are then moved over the
 * target with {@link StandardCopyOption#ATOMIC_MOVE}, so a crash mid-write leaves
 * the previous value intact.
 */
public class JsonFileStateStore<V> implements StateStore<V> {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Class<V> type;
    private final ObjectMapper mapper;

    public JsonFileStateStore(Path directory, Class<V> type, ObjectMapper mapper) {
        this.directory = directory;
        this.type = type;
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StateStoreException.StoreInitializationException(
                    "cannot create " + directory.toAbsolutePath() + ": " + e.getMessage(), e);
        }
        LoggerUtil.info("[JsonFileStateStore] " + type.getSimpleName() + " store at: " + directory.toAbsolutePath());
    }

    @Override
    public Optional<V> get(String key) {
        Path file = fileFor(key);
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StateStoreException("Failed to read state for key " + key + ": " + e.getMessage(), e);
        }

        try {
            V value = mapper.readValue(json, type);
            if (value == null) {
                throw new StateStoreException.CorruptStateException(key, null);
            }
            return Optional.of(value);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StateStoreException.CorruptStateException(key, e);
        }
    }

    @Override
    public void put(String key, V value) {
        Path target = fileFor(key);
        Path tempPath = null;
        try {
            byte[] bytes = mapper.writeValueAsBytes(value);
            tempPath = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.write(tempPath, bytes);
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(tempPath);
            throw new StateStoreException.WriteFailedException(key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new StateStoreException.WriteFailedException(key, e);
        }
    }

    @Override
    public Set<String> keys() {
        Set<String> keys = new HashSet<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                 .filter(name -> name.endsWith(SUFFIX))
                 .forEach(name -> keys.add(decodeKey(name.substring(0, name.length() - SUFFIX.length()))));
        } catch (IOException e) {
            throw new StateStoreException("Failed to list " + directory + ": " + e.getMessage(), e);
        }
        return keys;
    }

    public Path getDirectory() {
        return directory;
    }

    Path fileFor(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("State key cannot be null or empty");
        }
        return directory.resolve(encodeKey(key) + SUFFIX);
    }

    /**
     * Keys may contain ':' and arbitrary id characters; URL encoding keeps file names
     * portable and reversible.
     */
    static String encodeKey(String key) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8).replace("*", "%2A");
    }

    static String decodeKey(String fileStem) {
        return URLDecoder.decode(fileStem, StandardCharsets.UTF_8);
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LoggerUtil.debug("[JsonFileStateStore] Could not remove temp file " + path + ": " + e.getMessage());
        }
    }
}
