package com.banklink.storage;

import com.banklink.common.exception.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Secure tier backed by the service's database.
 *
 * Any data access failure is reported as {@link StorageUnavailableException};
 * there is no secondary store. Writes flush inside the guarded block so a
 * constraint or connection failure surfaces there, not at commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaSecurePersistence implements SecurePersistence {

    private final SecureRecordRepository recordRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void write(String key, String value) {
        try {
            SecureRecord record = recordRepository.findById(key)
                .orElseGet(() -> new SecureRecord(key, value, clock.instant()));
            record.setRecordValue(value);
            record.setUpdatedAt(clock.instant());
            recordRepository.saveAndFlush(record);
        } catch (DataAccessException e) {
            throw unavailable("write", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> read(String key) {
        try {
            return recordRepository.findById(key).map(SecureRecord::getRecordValue);
        } catch (DataAccessException e) {
            throw unavailable("read", e);
        }
    }

    @Override
    @Transactional
    public void delete(String key) {
        try {
            if (recordRepository.existsById(key)) {
                recordRepository.deleteById(key);
                recordRepository.flush();
            }
        } catch (DataAccessException e) {
            throw unavailable("delete", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> keys(String prefix) {
        try {
            return recordRepository.findKeysByPrefix(prefix);
        } catch (DataAccessException e) {
            throw unavailable("list", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            recordRepository.count();
            return true;
        } catch (DataAccessException e) {
            log.warn("Secure persistence health check failed: {}", e.getMessage());
            return false;
        }
    }

    private StorageUnavailableException unavailable(String operation, DataAccessException cause) {
        log.error("Secure persistence {} failed: {}", operation, cause.getMessage());
        return new StorageUnavailableException("Secure storage unavailable during " + operation, cause);
    }
}
