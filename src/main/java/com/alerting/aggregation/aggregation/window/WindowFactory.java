package com.alerting.aggregation.aggregation.window;

import com.alerting.aggregation.domain.WindowType;
import com.alerting.aggregation.persistence.entity.StrategyEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Builds the {@link WindowConfig} of a strategy scan from the strategy's raw params.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WindowFactory {

    public static final String WINDOW_SIZE = "window_size";
    public static final String TIME_OUT = "time_out";
    public static final String TIME_MINUTES = "time_minutes";
    public static final String WINDOW_TYPE = "window_type";

    static final int DEFAULT_WINDOW_SIZE_MINUTES = 10;

    private final Clock clock;

    public WindowConfig createFromStrategy(StrategyEntity strategy) {
        Map<String, Object> params = strategy.getParams() == null ? Map.of() : strategy.getParams();
        int windowSize = readMinutes(params, WINDOW_SIZE, DEFAULT_WINDOW_SIZE_MINUTES, strategy.getId());

        if (readBoolean(params.get(TIME_OUT))) {
            Integer timeout = params.get(TIME_MINUTES) == null
                    ? null
                    : readMinutes(params, TIME_MINUTES, DEFAULT_WINDOW_SIZE_MINUTES, strategy.getId());
            return WindowConfig.builder()
                    .windowType(WindowType.SESSION)
                    .windowSizeMinutes(windowSize)
                    .sessionTimeoutMinutes(timeout)
                    .now(clock.instant())
                    .build();
        }
        WindowType type = "fixed".equalsIgnoreCase(String.valueOf(params.get(WINDOW_TYPE)))
                ? WindowType.FIXED
                : WindowType.SLIDING;
        return WindowConfig.builder()
                .windowType(type)
                .windowSizeMinutes(windowSize)
                .now(clock.instant())
                .build();
    }

    private static int readMinutes(Map<String, Object> params, String key, int defaultValue, Long strategyId) {
        Object raw = params.get(key);
        if (raw == null) {
            return defaultValue;
        }
        Integer value = parsePositiveInt(raw);
        if (value != null) {
            return value;
        }
        log.warn("Invalid window param, using default: strategyId={}, param={}, value={}, default={}",
                strategyId, key, raw, defaultValue);
        return defaultValue;
    }

    private static Integer parsePositiveInt(Object raw) {
        if (raw instanceof Number) {
            int value = ((Number) raw).intValue();
            return value > 0 ? value : null;
        }
        String text = raw.toString().trim();
        if (!text.matches("\\d{1,9}")) {
            return null;
        }
        int value = Integer.parseInt(text);
        return value > 0 ? value : null;
    }

    private static boolean readBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        return raw != null && Boolean.parseBoolean(raw.toString().trim());
    }
}
