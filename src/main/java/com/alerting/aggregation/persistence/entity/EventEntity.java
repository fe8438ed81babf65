package com.alerting.aggregation.persistence.entity;

import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.persistence.converter.StringMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw monitoring event as written by the ingestion pipeline. Never mutated afterwards;
 * the aggregation engine only reads events and links them to alerts.
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_event_event_id", columnList = "event_id", unique = true),
    @Index(name = "idx_event_external_id", columnList = "external_id"),
    @Index(name = "idx_event_received_at", columnList = "received_at"),
    @Index(name = "idx_event_action", columnList = "event_action")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @EqualsAndHashCode.Include
    @Column(name = "event_id", nullable = false, unique = true, length = 100)
    private String eventId;

    /** Correlation key of the source system; matches CREATED events to their RECOVERY/CLOSED. */
    @Column(name = "external_id")
    private String externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_action", nullable = false, length = 20)
    private EventAction action;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @Column(name = "event_level", length = 20)
    private String level;

    @Column(name = "resource_name")
    private String resourceName;

    @Column(name = "resource_id")
    private String resourceId;

    @Column(name = "resource_type")
    private String resourceType;

    @Column(name = "item")
    private String item;

    @Column(name = "source_id")
    private String sourceId;

    @Column(name = "service")
    private String service;

    @Column(name = "location")
    private String location;

    @Column(name = "event_type", length = 50)
    private String eventType;

    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "labels", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    @Convert(converter = StringMapConverter.class)
    @Column(name = "tags", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();

    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }
}
