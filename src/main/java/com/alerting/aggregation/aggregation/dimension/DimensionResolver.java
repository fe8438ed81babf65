package com.alerting.aggregation.aggregation.dimension;

import com.alerting.aggregation.domain.DimensionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Maps a strategy's grouping granularity to the ordered dimension sets to try.
 *
 * <p>For the preset levels the result starts at the declared level and walks the
 * fallback order APPLICATION, INFRASTRUCTURE, INSTANCE, always ending with the
 * per-event set {@code [event_id]}. A custom strategy uses its own dimensions, or the
 * per-event set when it declares none.</p>
 */
@Slf4j
@Component
public class DimensionResolver {

    public static final List<String> EVENT_ID_DIMENSIONS = List.of("event_id");

    private static final List<DimensionType> FALLBACK_ORDER =
            List.of(DimensionType.APPLICATION, DimensionType.INFRASTRUCTURE, DimensionType.INSTANCE);

    public List<List<String>> resolve(String rawDimensionType, List<String> customDimensions) {
        Optional<DimensionType> parsed = DimensionType.parse(rawDimensionType);
        DimensionType type = parsed.orElseGet(() -> {
            log.warn("Unknown dimension type '{}', falling back to {}", rawDimensionType, DimensionType.INSTANCE);
            return DimensionType.INSTANCE;
        });
        return resolve(type, customDimensions);
    }

    public List<List<String>> resolve(DimensionType type, List<String> customDimensions) {
        if (type == DimensionType.CUSTOM) {
            if (customDimensions == null || customDimensions.isEmpty()) {
                return List.of(EVENT_ID_DIMENSIONS);
            }
            return List.of(List.copyOf(customDimensions));
        }
        List<List<String>> candidates = new ArrayList<>();
        for (int i = FALLBACK_ORDER.indexOf(type); i < FALLBACK_ORDER.size(); i++) {
            candidates.add(FALLBACK_ORDER.get(i).presetDimensions());
        }
        candidates.add(EVENT_ID_DIMENSIONS);
        return Collections.unmodifiableList(candidates);
    }
}
