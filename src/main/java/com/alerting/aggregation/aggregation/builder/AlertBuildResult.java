package com.alerting.aggregation.aggregation.builder;

import com.alerting.aggregation.persistence.entity.AlertEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying one grouping query's rows to the alert store.
 *
 * @param alerts alerts created or updated, in row order
 */
public record AlertBuildResult(int created, int updated, int linkedEvents, List<AlertEntity> alerts) {

    public static AlertBuildResult empty() {
        return new AlertBuildResult(0, 0, 0, List.of());
    }

    public AlertBuildResult plus(AlertBuildResult other) {
        List<AlertEntity> merged = new ArrayList<>(alerts);
        merged.addAll(other.alerts);
        return new AlertBuildResult(created + other.created, updated + other.updated,
                linkedEvents + other.linkedEvents, merged);
    }
}
