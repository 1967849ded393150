package com.sensorsentinel.core.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link KeyValueStore} held in memory. Nothing survives the process.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> getString(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void setString(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        entries.put(key, value);
    }
}
