package com.alerting.aggregation.persistence.repository;

import com.alerting.aggregation.persistence.entity.StrategyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read-only view of aggregation strategies.
 */
@Repository
public interface StrategyRepository extends JpaRepository<StrategyEntity, Long> {

    List<StrategyEntity> findByActiveTrueOrderByUpdatedAtDesc();

    List<StrategyEntity> findByActiveTrueAndAutoCloseTrueAndCloseMinutesGreaterThan(int closeMinutes);
}
