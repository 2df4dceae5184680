package com.fixforge.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fixforge.core.config.FixforgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Named JSON documents stored as {@code <dataDir>/<name>.json}.
 * <p>
 * Writes go to {@code <name>.json.tmp} and are then moved over the target in
 * one step, so a reader sees either the previous or the new document, never a
 * partial one. All operations on one instance are serialized. Failures are
 * logged and reported as {@code false} or the caller's default.
 */
@Component
public class DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);
    private static final String EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path dataDir;
    private final ObjectMapper objectMapper;
    private final Object lock = new Object();

    @Autowired
    public DocumentStore(FixforgeProperties properties) {
        this(Path.of(properties.getDataDir()));
    }

    public DocumentStore(Path dataDir) {
        this.dataDir = dataDir;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            log.error("Failed to create data directory {}", dataDir, e);
        }
    }

    /**
     * Atomically replaces the document called {@code name}.
     *
     * @return true if the document is now durable on disk
     */
    public boolean save(String name, JsonNode document) {
        Path target = pathOf(name);
        Path temp = dataDir.resolve(name + EXTENSION + TEMP_SUFFIX);
        synchronized (lock) {
            try {
                Files.createDirectories(dataDir);
                objectMapper.writeValue(temp.toFile(), document);
                move(temp, target);
                log.debug("Saved document '{}'", name);
                return true;
            } catch (IOException e) {
                log.error("Failed to save document '{}'", name, e);
                return false;
            }
        }
    }

    /**
     * Reads the document called {@code name}, or returns {@code defaultValue}
     * when it does not exist or cannot be parsed.
     */
    public JsonNode load(String name, JsonNode defaultValue) {
        Path source = pathOf(name);
        synchronized (lock) {
            if (!Files.exists(source)) {
                return defaultValue;
            }
            try {
                JsonNode node = objectMapper.readTree(source.toFile());
                return node != null && !node.isMissingNode() ? node : defaultValue;
            } catch (IOException e) {
                log.error("Failed to load document '{}'", name, e);
                return defaultValue;
            }
        }
    }

    public boolean delete(String name) {
        synchronized (lock) {
            try {
                Files.deleteIfExists(pathOf(name));
                return true;
            } catch (IOException e) {
                log.error("Failed to delete document '{}'", name, e);
                return false;
            }
        }
    }

    public boolean exists(String name) {
        synchronized (lock) {
            return Files.exists(pathOf(name));
        }
    }

    /** Names of all stored documents; temp files are not listed. */
    public Set<String> list() {
        synchronized (lock) {
            var names = new TreeSet<String>();
            if (!Files.isDirectory(dataDir)) {
                return names;
            }
            try (Stream<Path> files = Files.list(dataDir)) {
                files.map(p -> p.getFileName().toString())
                        .filter(f -> f.endsWith(EXTENSION))
                        .forEach(f -> names.add(f.substring(0, f.length() - EXTENSION.length())));
            } catch (IOException e) {
                log.error("Failed to list documents in {}", dataDir, e);
            }
            return names;
        }
    }

    public Path getDataDir() {
        return dataDir;
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    private Path pathOf(String name) {
        return dataDir.resolve(name + EXTENSION);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
