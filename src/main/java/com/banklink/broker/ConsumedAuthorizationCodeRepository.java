package com.banklink.broker;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface ConsumedAuthorizationCodeRepository extends JpaRepository<ConsumedAuthorizationCode, String> {

    @Modifying
    @Query("delete from ConsumedAuthorizationCode c where c.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
