package org.caureq.caureqalertdesk.repo;

import org.caureq.caureqalertdesk.api.dto.RecentActivityDTO;
import org.caureq.caureqalertdesk.api.dto.TopOffenderDTO;
import org.caureq.caureqalertdesk.domain.AlertRecord;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface AlertRepo extends JpaRepository<AlertRecord, String>, JpaSpecificationExecutor<AlertRecord> {
    List<AlertRecord> findByEntityKeyAndSourceTypeAndTsGreaterThanEqual(String entityKey, SourceType sourceType, Instant since);

    @Query("select a from AlertRecord a where a.status in :statuses "
            + "and (a.ts > :ts or (a.ts = :ts and a.id > :id)) "
            + "order by a.ts asc, a.id asc")
    List<AlertRecord> findPendingAfter(@Param("statuses") Collection<AlertStatus> statuses,
                                       @Param("ts") Instant ts, @Param("id") String id, Pageable page);

    Page<AlertRecord> findByStatusAndClosedAtGreaterThanEqual(AlertStatus status, Instant since, Pageable pageable);
    List<AlertRecord> findByTsGreaterThanEqual(Instant since);

    @Query("select a.status, count(a) from AlertRecord a group by a.status")
    List<Object[]> countByStatus();

    @Query("select a.severity, count(a) from AlertRecord a group by a.severity")
    List<Object[]> countBySeverity();

    @Query("select a.sourceType, count(a) from AlertRecord a group by a.sourceType")
    List<Object[]> countBySourceType();

    String OPEN_ONE = "case when a.status = org.caureq.caureqalertdesk.domain.AlertStatus.OPEN then 1L else 0L end";
    String ESCALATED_ONE = "case when a.status = org.caureq.caureqalertdesk.domain.AlertStatus.ESCALATED then 1L else 0L end";

    /** Entities with the most open/escalated alerts, escalated first. */
    @Query("select new org.caureq.caureqalertdesk.api.dto.TopOffenderDTO(a.entityKey, sum(" + OPEN_ONE + "), sum("
            + ESCALATED_ONE + "), count(a), max(a.ts)) from AlertRecord a"
            + " where a.status in :statuses and a.entityKey is not null group by a.entityKey"
            + " order by sum(" + ESCALATED_ONE + ") desc, sum(" + OPEN_ONE + ") desc, a.entityKey asc")
    List<TopOffenderDTO> topOffenders(@Param("statuses") Collection<AlertStatus> statuses, Pageable pageable);

    @Query("select new org.caureq.caureqalertdesk.api.dto.RecentActivityDTO(a.id, a.sourceType, a.severity, a.status,"
            + " a.entityKey, h.ts, h.fromStatus, h.toStatus, h.reason, h.triggeredBy)"
            + " from AlertRecord a join a.stateHistory h order by h.ts desc")
    List<RecentActivityDTO> recentActivities(Pageable pageable);
}
