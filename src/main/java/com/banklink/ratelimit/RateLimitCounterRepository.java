package com.banklink.ratelimit;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface RateLimitCounterRepository extends JpaRepository<RateLimitCounter, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from RateLimitCounter c where c.bucketKey = :bucketKey")
    Optional<RateLimitCounter> findForUpdate(@Param("bucketKey") String bucketKey);

    @Modifying
    @Query("delete from RateLimitCounter c where c.windowEnd < :now")
    int deleteEndedBefore(@Param("now") Instant now);
}
