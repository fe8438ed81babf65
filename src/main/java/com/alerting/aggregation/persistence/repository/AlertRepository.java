package com.alerting.aggregation.persistence.repository;

import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.domain.SessionStatus;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.entity.EventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for alerts and their event membership.
 */
@Repository
public interface AlertRepository extends JpaRepository<AlertEntity, Long> {

    Optional<AlertEntity> findByAlertId(String alertId);

    List<AlertEntity> findByRuleIdAndFingerprintAndStatusInOrderByUpdatedAtDesc(
            Long ruleId, String fingerprint, Collection<AlertStatus> statuses);

    List<AlertEntity> findByRuleIdInAndStatusIn(Collection<Long> ruleIds, Collection<AlertStatus> statuses);

    @Query("SELECT DISTINCT a FROM AlertEntity a JOIN a.events e WHERE e.externalId IN :externalIds AND a.status IN :statuses")
    List<AlertEntity> findByEventExternalIds(@Param("externalIds") Collection<String> externalIds,
                                             @Param("statuses") Collection<AlertStatus> statuses);

    /**
     * Alerts owning at least one event with the given action and one of the external ids,
     * with their full event sets fetched in the same query.
     */
    @Query("SELECT DISTINCT a FROM AlertEntity a LEFT JOIN FETCH a.events "
            + "WHERE a.status IN :statuses AND a.id IN ("
            + "SELECT a2.id FROM AlertEntity a2 JOIN a2.events e2 "
            + "WHERE e2.action = :action AND e2.externalId IN :externalIds)")
    List<AlertEntity> findWithEventsByOwnedExternalIds(@Param("externalIds") Collection<String> externalIds,
                                                       @Param("action") EventAction action,
                                                       @Param("statuses") Collection<AlertStatus> statuses);

    @Query("SELECT e FROM AlertEntity a JOIN a.events e WHERE a.id = :alertPk ORDER BY e.receivedAt")
    List<EventEntity> findEventsOfAlert(@Param("alertPk") Long alertPk);

    @Query("SELECT e.eventId FROM AlertEntity a JOIN a.events e WHERE a.id = :alertPk")
    Set<String> findLinkedEventIds(@Param("alertPk") Long alertPk);

    @Query("SELECT a FROM AlertEntity a WHERE a.sessionAlert = true AND a.sessionStatus = :sessionStatus "
            + "AND a.status IN :statuses AND a.sessionEndTime IS NOT NULL")
    List<AlertEntity> findSessionAlertsWithDeadline(@Param("sessionStatus") SessionStatus sessionStatus,
                                                    @Param("statuses") Collection<AlertStatus> statuses);

    @Query("SELECT a FROM AlertEntity a WHERE a.ruleId = :ruleId AND a.sessionAlert = true AND a.sessionStatus = :sessionStatus")
    List<AlertEntity> findSessionAlertsByRule(@Param("ruleId") Long ruleId,
                                              @Param("sessionStatus") SessionStatus sessionStatus);
}
