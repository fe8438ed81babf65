package com.alerting.aggregation.persistence.entity;

import com.alerting.aggregation.persistence.converter.JsonMapConverter;
import com.alerting.aggregation.persistence.converter.MatchRulesConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregation strategy as maintained by the strategy configuration service. The engine
 * reads it and never writes it.
 *
 * <p>{@code params} keeps the raw parameter map: {@code window_size} (minutes),
 * {@code time_out} (session window switch), {@code time_minutes} (session timeout) and
 * optionally {@code window_type} ({@code fixed}).</p>
 */
@Entity
@Table(name = "strategies")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    /** Raw value; parsed by the dimension resolver, which tolerates unknown values. */
    @Column(name = "dimension_type", length = 30)
    private String dimensionType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "strategy_custom_dimensions", joinColumns = @JoinColumn(name = "strategy_id"))
    @OrderColumn(name = "position")
    @Column(name = "dimension", nullable = false)
    @Builder.Default
    private List<String> customDimensions = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "params", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    @Column(name = "min_event_count")
    @Builder.Default
    private int minEventCount = 1;

    @Convert(converter = MatchRulesConverter.class)
    @Column(name = "match_rules", columnDefinition = "TEXT")
    @Builder.Default
    private List<List<Map<String, Object>>> matchRules = new ArrayList<>();

    @Column(name = "auto_close", nullable = false)
    private boolean autoClose;

    @Column(name = "close_minutes")
    private int closeMinutes;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
