package com.banklink.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-sensitive tier. Never used for tokens, OAuth state or cached financial data.
 *
 * Writes go to the database; when it is unreachable the value is kept in an
 * in-memory fallback so the caller can carry on. Reads prefer the database
 * and consult the fallback on failure or for keys written during an outage.
 */
@Component
@Slf4j
public class NonSensitiveStore {

    private final PlainRecordRepository recordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, String> fallback = new ConcurrentHashMap<>();

    public NonSensitiveStore(PlainRecordRepository recordRepository, ObjectMapper objectMapper, Clock clock) {
        this.recordRepository = recordRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void set(String key, String value) {
        try {
            PlainRecord record = recordRepository.findById(key)
                .orElseGet(() -> new PlainRecord(key, value, clock.instant()));
            record.setRecordValue(value);
            record.setUpdatedAt(clock.instant());
            recordRepository.save(record);
            fallback.remove(key);
        } catch (DataAccessException e) {
            log.warn("Non-sensitive store write failed for {}, keeping value in memory: {}", key, e.getMessage());
            fallback.put(key, value);
        }
    }

    public Optional<String> get(String key) {
        String pending = fallback.get(key);
        if (pending != null) {
            return Optional.of(pending);
        }
        try {
            return recordRepository.findById(key).map(PlainRecord::getRecordValue);
        } catch (DataAccessException e) {
            log.warn("Non-sensitive store read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void delete(String key) {
        fallback.remove(key);
        try {
            if (recordRepository.existsById(key)) {
                recordRepository.deleteById(key);
            }
        } catch (DataAccessException e) {
            log.warn("Non-sensitive store delete failed for {}: {}", key, e.getMessage());
        }
    }

    public <T> void setJson(String key, T value) {
        try {
            set(key, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for " + key + " is not serializable", e);
        }
    }

    public <T> Optional<T> getJson(String key, TypeReference<T> type) {
        return get(key).flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, type));
            } catch (JsonProcessingException e) {
                log.warn("Discarding unreadable non-sensitive record {}", key);
                return Optional.empty();
            }
        });
    }
}
