package com.g11macro.manager.service;

import com.g11macro.manager.config.MacroConfigProperties;
import com.g11macro.manager.exception.ConfigStorageException;
import com.g11macro.manager.exception.InvalidEnumValueException;
import com.g11macro.manager.exception.RonParseException;
import com.g11macro.manager.model.KeyBinding;
import com.g11macro.manager.ron.RonParser;
import com.g11macro.manager.ron.RonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the daemon's binding files.
 */
@Service
public class BindingsStore {

    private static final Logger logger = LoggerFactory.getLogger(BindingsStore.class);

    static final String STUB = RonSerializer.HEADER + "\n"
            + "[\n"
            + "//This file contains individual G key scripts as used by the g11-macro-daemon.\n"
            + "//Add your KeyBinding entries here and restart the daemon to apply them.\n"
            + "\n"
            + "\n"
            + "]\n";

    private final MacroConfigProperties properties;

    public BindingsStore(MacroConfigProperties properties) {
        this.properties = properties;
    }

    public record LoadResult(List<KeyBinding> bindings, String error) {

        static LoadResult success(List<KeyBinding> bindings) {
            return new LoadResult(bindings, null);
        }

        static LoadResult failure(String error) {
            return new LoadResult(new ArrayList<>(), error);
        }

        public boolean hasError() {
            return error != null;
        }
    }

    public Path bindingsPath() {
        return properties.bindingsPath();
    }

    public Path recordingsPath() {
        return properties.recordingsPath();
    }

    public LoadResult loadBindings() {
        return load(bindingsPath());
    }

    /**
     * Bindings the daemon recorded on its own. The editor never writes this file.
     */
    public LoadResult loadRecordings() {
        return load(recordingsPath());
    }

    public synchronized void saveBindings(List<KeyBinding> bindings) throws ConfigStorageException {
        Path path = bindingsPath();
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, RonSerializer.serialize(bindings), StandardCharsets.UTF_8);
            logger.info("Saved {} bindings to {}", bindings.size(), path);
        } catch (IOException e) {
            logger.error("Failed to save bindings to {}: {}", path, e.getMessage());
            throw new ConfigStorageException("Save failed: " + e.getMessage(), e);
        }
    }

    /**
     * Replaces the binding with the same {@code (m, g)} or appends it, then saves the whole file.
     * Duplicate keys already in the file collapse to their last occurrence.
     *
     * <p>Synchronized so concurrent requests cannot drop each other's update. Writers outside
     * this process (a text editor) are not guarded against.
     */
    public synchronized List<KeyBinding> upsertBinding(KeyBinding binding) throws ConfigStorageException {
        LoadResult current = loadBindings();
        if (current.hasError()) {
            throw new ConfigStorageException("Cannot update bindings, current file is invalid: " + current.error());
        }

        Map<KeyBinding.KeyId, KeyBinding> byKey = index(current.bindings());
        boolean replaced = byKey.put(binding.keyId(), binding) != null;
        logger.info("{} binding M{}/G{}", replaced ? "Replacing" : "Adding", binding.m(), binding.g());

        List<KeyBinding> updated = new ArrayList<>(byKey.values());
        saveBindings(updated);
        return updated;
    }

    public Optional<KeyBinding> findBinding(int m, int g) {
        LoadResult current = loadBindings();
        return Optional.ofNullable(index(current.bindings()).get(new KeyBinding.KeyId(m, g)));
    }

    /**
     * Creates the config directory, and the bindings file with an empty stub if it is missing.
     */
    public void ensureConfigDirectory() throws ConfigStorageException {
        Path path = bindingsPath();
        try {
            Files.createDirectories(path.getParent());
            if (!Files.exists(path)) {
                Files.writeString(path, STUB, StandardCharsets.UTF_8);
                logger.info("Created bindings stub at {}", path);
            }
        } catch (IOException e) {
            logger.error("Failed to prepare config directory {}: {}", path.getParent(), e.getMessage());
            throw new ConfigStorageException("Cannot create config directory: " + e.getMessage(), e);
        }
    }

    static Map<KeyBinding.KeyId, KeyBinding> index(List<KeyBinding> bindings) {
        Map<KeyBinding.KeyId, KeyBinding> byKey = new LinkedHashMap<>();
        for (KeyBinding binding : bindings) {
            byKey.put(binding.keyId(), binding);
        }
        return byKey;
    }

    private LoadResult load(Path path) {
        if (!Files.exists(path)) {
            logger.debug("No file at {}, nothing to load", path);
            return LoadResult.success(new ArrayList<>());
        }
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            List<KeyBinding> bindings = RonParser.parse(text);
            logger.info("Loaded {} bindings from {}", bindings.size(), path);
            return LoadResult.success(bindings);
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", path, e.getMessage());
            return LoadResult.failure(e.getMessage());
        } catch (RonParseException | InvalidEnumValueException e) {
            logger.warn("Config error in {}: {}", path, e.getMessage());
            return LoadResult.failure(e.getMessage());
        }
    }
}
