package work.sdl2.canvas.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry around status queries only. Submission is never retried. {@link #NONE} (the default)
 * lets the first transport failure end the step.
 */
public record StatusRetryPolicy(int maxRetries, Duration initialBackoff, double multiplier) {
    public static final StatusRetryPolicy NONE = new StatusRetryPolicy(0, Duration.ZERO, 1.0);

    public StatusRetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
    }

    public static StatusRetryPolicy of(int maxRetries, Duration initialBackoff) {
        return maxRetries == 0 ? NONE : new StatusRetryPolicy(maxRetries, initialBackoff, 2.0);
    }

    Duration backoff(int retry) {
        double factor = Math.pow(multiplier, retry);
        return Duration.ofNanos((long) (initialBackoff.toNanos() * factor));
    }
}
