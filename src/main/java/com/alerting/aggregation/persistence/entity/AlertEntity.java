package com.alerting.aggregation.persistence.entity;

import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.domain.SessionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Persistent alert: the aggregate of events sharing one fingerprint within a strategy's
 * window scope. Updates only write changed columns and are guarded by the version
 * column, so concurrent passes touching disjoint fields do not clobber each other.
 */
@Entity
@Table(name = "alerts", indexes = {
    @Index(name = "idx_alert_alert_id", columnList = "alert_id", unique = true),
    @Index(name = "idx_alert_fingerprint", columnList = "fingerprint"),
    @Index(name = "idx_alert_rule_status", columnList = "rule_id, status"),
    @Index(name = "idx_alert_session", columnList = "session_status, session_end_time")
})
@DynamicUpdate
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "events")
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @EqualsAndHashCode.Include
    @Column(name = "alert_id", nullable = false, unique = true, length = 64)
    private String alertId;

    @Column(name = "fingerprint", nullable = false, length = 32)
    private String fingerprint;

    /** Owning strategy. */
    @Column(name = "rule_id", nullable = false)
    private Long ruleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private AlertStatus status = AlertStatus.UNASSIGNED;

    @Column(name = "alert_level", length = 20)
    private String level;

    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "group_by_field")
    private String groupByField;

    @Column(name = "is_session_alert", nullable = false)
    private boolean sessionAlert;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_status", length = 20)
    private SessionStatus sessionStatus;

    @Column(name = "session_end_time")
    private Instant sessionEndTime;

    @Column(name = "first_event_time")
    private Instant firstEventTime;

    @Column(name = "last_event_time")
    private Instant lastEventTime;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "alert_events",
            joinColumns = @JoinColumn(name = "alert_pk"),
            inverseJoinColumns = @JoinColumn(name = "event_pk"))
    @Builder.Default
    private Set<EventEntity> events = new LinkedHashSet<>();

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isObservingSession() {
        return sessionAlert && sessionStatus == SessionStatus.OBSERVING;
    }

    /**
     * Moves the session status forward. Returns false, leaving the alert untouched,
     * when the move would go backwards.
     */
    public boolean advanceSessionStatus(SessionStatus target) {
        if (sessionStatus == null || !sessionStatus.canTransitionTo(target)) {
            return false;
        }
        sessionStatus = target;
        return true;
    }
}
