package com.banklink.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SecurityEventRepository extends JpaRepository<SecurityEvent, String> {

    List<SecurityEvent> findByEventTypeOrderByOccurredAtAsc(SecurityEventType eventType);

    List<SecurityEvent> findByUserHashOrderByOccurredAtAsc(String userHash);

    @Modifying
    @Query("delete from SecurityEvent e where e.occurredAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
