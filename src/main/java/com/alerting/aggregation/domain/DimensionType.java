package com.alerting.aggregation.domain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Grouping granularity declared by a strategy. The non-custom levels are ordered from the
 * application level down to the instance level; that order is the fallback walk used by
 * the dimension resolver.
 */
public enum DimensionType {
    APPLICATION(List.of("service")),
    INFRASTRUCTURE(List.of("location")),
    INSTANCE(List.of("resource_name")),
    CUSTOM(List.of());

    private final List<String> presetDimensions;

    DimensionType(List<String> presetDimensions) {
        this.presetDimensions = presetDimensions;
    }

    public List<String> presetDimensions() {
        return presetDimensions;
    }

    /**
     * Parses the raw value stored on a strategy. Case and surrounding whitespace are ignored.
     */
    public static Optional<DimensionType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
