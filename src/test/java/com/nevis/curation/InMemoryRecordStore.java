package com.nevis.curation;

import com.nevis.curation.repository.RecordStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Map-backed store for unit tests. Records are kept as objects, without serialization.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, Map<String, Object>> namespaces = new LinkedHashMap<>();

    @Override
    public synchronized void put(String namespace, String key, Object record) {
        namespaces.computeIfAbsent(namespace, ns -> new LinkedHashMap<>()).put(key, record);
    }

    @Override
    public synchronized void putAll(List<StoredRecord> records) {
        records.forEach(stored -> put(stored.namespace(), stored.key(), stored.record()));
    }

    @Override
    public synchronized <T> Optional<T> get(String namespace, String key, Class<T> type) {
        return Optional.ofNullable(namespaces.getOrDefault(namespace, Map.of()).get(key)).map(type::cast);
    }

    @Override
    public synchronized <T> List<T> query(String namespace, Class<T> type, Predicate<? super T> filter) {
        return namespaces.getOrDefault(namespace, Map.of()).values().stream()
            .map(type::cast)
            .filter(filter)
            .toList();
    }

    public synchronized int size(String namespace) {
        return namespaces.getOrDefault(namespace, Map.of()).size();
    }
}
