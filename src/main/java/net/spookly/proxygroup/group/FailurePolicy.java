package net.spookly.proxygroup.group;

import java.time.Duration;
import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * How many dial failures within what window escalate a group to a health check.
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
public final class FailurePolicy {
    public static final int DEFAULT_MAX_FAILED_TIMES = 5;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(5);
    public static final FailurePolicy DEFAULT = new FailurePolicy(DEFAULT_MAX_FAILED_TIMES, DEFAULT_WINDOW);

    private final int maxFailedTimes;
    private final Duration window;

    public FailurePolicy(int maxFailedTimes, Duration window) {
        if (maxFailedTimes <= 0) {
            throw new IllegalArgumentException("maxFailedTimes must be positive");
        }
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxFailedTimes = maxFailedTimes;
        this.window = window;
    }
}
