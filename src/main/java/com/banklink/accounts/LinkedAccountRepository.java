package com.banklink.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LinkedAccountRepository extends JpaRepository<LinkedAccount, Long> {

    List<LinkedAccount> findByOwnerUserIdOrderByDisplayNameAsc(String ownerUserId);

    List<LinkedAccount> findByConnectionId(String connectionId);

    @Modifying
    @Query("delete from LinkedAccount a where a.connectionId = :connectionId")
    int deleteByConnectionId(@Param("connectionId") String connectionId);
}
