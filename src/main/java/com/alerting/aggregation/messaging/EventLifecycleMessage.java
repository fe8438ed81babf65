package com.alerting.aggregation.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Notification published by the ingestion pipeline after it stored a batch of events.
 * Carries ids only; the events themselves are read from the event store.
 */
@Value
@Builder
@Jacksonized
public class EventLifecycleMessage {

    List<String> eventIds;
    /** Ingesting component, for logs. */
    String source;
    Instant publishedAt;
}
