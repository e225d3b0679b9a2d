package net.modshub.repository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link KeyValueStore} backed by {@link ConcurrentHashMap}, whose
 * {@code putIfAbsent} and two-argument {@code remove} are atomic per key.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final String namespace;
    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore(String namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public Optional<String> putIfAbsent(String key, String value) {
        return Optional.ofNullable(entries.putIfAbsent(key, value));
    }

    @Override
    public void put(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        return entries.remove(key, expectedValue);
    }

    @Override
    public List<String> keys() {
        return entries.keySet().stream().sorted().toList();
    }

    @Override
    public String namespace() {
        return namespace;
    }

    public int size() {
        return entries.size();
    }
}
