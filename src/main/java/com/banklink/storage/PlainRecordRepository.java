package com.banklink.storage;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlainRecordRepository extends JpaRepository<PlainRecord, String> {
}
