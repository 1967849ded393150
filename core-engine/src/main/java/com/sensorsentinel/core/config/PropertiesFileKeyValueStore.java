package com.sensorsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * {@link KeyValueStore} backed by a {@code .properties} file.
 *
 * <p>
 * The file is read once at construction and rewritten on every
 * {@link #setString(String, String)}. A missing file is treated as an empty
 * store and created on the first write.
 * </p>
 *
 * @since 1.0.0
 */
public class PropertiesFileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LoggerFactory.getLogger(PropertiesFileKeyValueStore.class);

    private final Path file;
    private final Properties properties = new Properties();

    /**
     * @param file location of the properties file; must not be {@code null}
     * @throws IllegalStateException if an existing file cannot be read
     */
    public PropertiesFileKeyValueStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        if (Files.exists(file)) {
            try (InputStream is = Files.newInputStream(file)) {
                properties.load(is);
                LOG.debug("Loaded {} setting(s) from {}", properties.size(), file);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read settings file: " + file, e);
            }
        }
    }

    @Override
    public synchronized Optional<String> getString(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(properties.getProperty(key));
    }

    /**
     * Write the file with {@code key} set, then update the in-memory view.
     *
     * @throws IllegalStateException if the file cannot be written; the
     *                               previous value stays visible
     */
    @Override
    public synchronized void setString(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Properties updated = new Properties();
        updated.putAll(properties);
        updated.setProperty(key, value);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream os = Files.newOutputStream(file)) {
                updated.store(os, "Sensor Sentinel settings");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write settings file: " + file, e);
        }
        properties.setProperty(key, value);
    }
}
