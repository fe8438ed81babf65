package com.alerting.aggregation.aggregation.window;

import com.alerting.aggregation.domain.WindowType;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * Time scope of one strategy scan, computed against a fixed reference time.
 */
@Getter
@Builder
@ToString
public class WindowConfig {

    @NonNull
    private final WindowType windowType;

    private final int windowSizeMinutes;

    /** Session timeout; {@code null} means the window size is used. */
    private final Integer sessionTimeoutMinutes;

    @NonNull
    private final Instant now;

    public boolean isSessionWindow() {
        return windowType == WindowType.SESSION;
    }

    public boolean isFixedWindow() {
        return windowType == WindowType.FIXED;
    }

    /**
     * Lower bound (inclusive) of the events in scope. For fixed windows this is the start of
     * the last complete window aligned to the window size.
     */
    public Instant getWindowStart() {
        if (isFixedWindow()) {
            return getWindowEnd().minus(Duration.ofMinutes(windowSizeMinutes));
        }
        return now.minus(Duration.ofMinutes(windowSizeMinutes));
    }

    /**
     * Upper bound (exclusive) of a fixed window; the reference time for the other types.
     */
    public Instant getWindowEnd() {
        if (!isFixedWindow()) {
            return now;
        }
        long sizeSeconds = windowSizeMinutes * 60L;
        long epochSeconds = now.getEpochSecond();
        return Instant.ofEpochSecond(epochSeconds - Math.floorMod(epochSeconds, sizeSeconds));
    }

    public int getEffectiveSessionTimeoutMinutes() {
        return sessionTimeoutMinutes != null && sessionTimeoutMinutes > 0 ? sessionTimeoutMinutes : windowSizeMinutes;
    }

    /**
     * Deadline after which an observing session with no recovery is confirmed.
     *
     * @throws IllegalStateException for non-session windows
     */
    public Instant getSessionEndTime() {
        if (!isSessionWindow()) {
            throw new IllegalStateException("Session end time is only defined for session windows, got " + windowType);
        }
        return now.plus(Duration.ofMinutes(getEffectiveSessionTimeoutMinutes()));
    }
}
