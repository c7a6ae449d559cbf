package com.banklink.storage;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SecureRecordRepository extends JpaRepository<SecureRecord, String> {

    @Query("select r.recordKey from SecureRecord r where r.recordKey like concat(:prefix, '%')")
    List<String> findKeysByPrefix(@Param("prefix") String prefix);
}
