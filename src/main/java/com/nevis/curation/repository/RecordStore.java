package com.nevis.curation.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Keyed storage for serialized records, grouped into namespaces.
 */
public interface RecordStore {

    String BATCHES = "batches";
    String CLUSTERS = "clusters";
    String CONTENT = "content";

    /**
     * Inserts or replaces the record stored under {@code key}.
     */
    void put(String namespace, String key, Object record);

    /**
     * Stores all records or none of them.
     */
    void putAll(List<StoredRecord> records);

    <T> Optional<T> get(String namespace, String key, Class<T> type);

    /**
     * Returns the records of a namespace accepted by {@code filter}, in insertion order.
     */
    <T> List<T> query(String namespace, Class<T> type, Predicate<? super T> filter);

    default <T> List<T> all(String namespace, Class<T> type) {
        return query(namespace, type, record -> true);
    }

    record StoredRecord(String namespace, String key, Object record) {
    }
}
