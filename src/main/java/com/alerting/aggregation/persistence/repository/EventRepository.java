package com.alerting.aggregation.persistence.repository;

import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.persistence.entity.EventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Read access to ingested events, sliced by action and arrival time.
 */
@Repository
public interface EventRepository extends JpaRepository<EventEntity, Long> {

    List<EventEntity> findByEventIdIn(Collection<String> eventIds);

    @Query("SELECT e FROM EventEntity e WHERE e.action = :action AND e.receivedAt >= :start ORDER BY e.receivedAt")
    List<EventEntity> findByActionSince(@Param("action") EventAction action, @Param("start") Instant start);

    /** Both bounds inclusive. */
    @Query("SELECT e FROM EventEntity e WHERE e.action = :action AND e.receivedAt >= :start AND e.receivedAt <= :end ORDER BY e.receivedAt")
    List<EventEntity> findByActionWithin(@Param("action") EventAction action,
                                         @Param("start") Instant start,
                                         @Param("end") Instant end);

    /** Lower bound inclusive, upper bound exclusive. */
    @Query("SELECT e FROM EventEntity e WHERE e.action = :action AND e.receivedAt >= :start AND e.receivedAt < :end ORDER BY e.receivedAt")
    List<EventEntity> findByActionBefore(@Param("action") EventAction action,
                                         @Param("start") Instant start,
                                         @Param("end") Instant end);

    @Query("SELECT e FROM EventEntity e WHERE e.action IN :actions AND e.receivedAt >= :since ORDER BY e.receivedAt")
    List<EventEntity> findByActionsSince(@Param("actions") Collection<EventAction> actions, @Param("since") Instant since);
}
