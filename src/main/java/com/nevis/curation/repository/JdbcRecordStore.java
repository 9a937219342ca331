package com.nevis.curation.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcRecordStore implements RecordStore {

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    @Override
    public void put(String namespace, String key, Object record) {
        jdbcClient.sql("""
                INSERT INTO curation_records (namespace, record_key, payload)
                VALUES (:namespace, :key, :payload::jsonb)
                ON CONFLICT (namespace, record_key)
                DO UPDATE SET payload = EXCLUDED.payload, updated_at = now()
                """)
            .param("namespace", namespace)
            .param("key", key)
            .param("payload", write(record))
            .update();
        log.debug("Stored {}/{}", namespace, key);
    }

    @Override
    @Transactional
    public void putAll(List<StoredRecord> records) {
        for (StoredRecord stored : records) {
            put(stored.namespace(), stored.key(), stored.record());
        }
        log.debug("Stored {} records in one transaction", records.size());
    }

    @Override
    public <T> Optional<T> get(String namespace, String key, Class<T> type) {
        return jdbcClient.sql("SELECT payload FROM curation_records WHERE namespace = :namespace AND record_key = :key")
            .param("namespace", namespace)
            .param("key", key)
            .query(String.class)
            .optional()
            .map(payload -> read(payload, type));
    }

    @Override
    public <T> List<T> query(String namespace, Class<T> type, Predicate<? super T> filter) {
        return jdbcClient.sql("""
                SELECT payload FROM curation_records
                WHERE namespace = :namespace
                ORDER BY created_at, record_key
                """)
            .param("namespace", namespace)
            .query(String.class)
            .list()
            .stream()
            .map(payload -> read(payload, type))
            .filter(filter)
            .toList();
    }

    private String write(Object record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record of type " + record.getClass().getSimpleName()
                + " cannot be serialized", e);
        }
    }

    private <T> T read(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored record is not a valid " + type.getSimpleName(), e);
        }
    }
}
