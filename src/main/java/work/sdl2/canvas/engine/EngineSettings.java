package work.sdl2.canvas.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Polling configuration handed to {@link WorkflowEngine#execute}. {@code maxWait} applies to each step.
 */
public record EngineSettings(Duration pollInterval, Duration maxWait, StatusRetryPolicy statusRetry) {
    public EngineSettings {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(maxWait, "maxWait");
        Objects.requireNonNull(statusRetry, "statusRetry");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must be >= 0");
        }
    }

    public static EngineSettings of(Duration pollInterval, Duration maxWait) {
        return new EngineSettings(pollInterval, maxWait, StatusRetryPolicy.NONE);
    }
}
