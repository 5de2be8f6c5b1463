package org.caureq.caureqalertdesk.repo;

import jakarta.persistence.LockModeType;
import org.caureq.caureqalertdesk.domain.AlertSequence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AlertSequenceRepo extends JpaRepository<AlertSequence, String> {
    /** Creates the counter at zero unless a concurrent caller already did. Returns the inserted row count. */
    @Modifying
    @Query(value = "insert into alert_sequences (id, sequence) values (:id, 0) on conflict do nothing",
            nativeQuery = true)
    int insertIfAbsent(@Param("id") String id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from AlertSequence s where s.id = :id")
    Optional<AlertSequence> findForUpdate(@Param("id") String id);
}
