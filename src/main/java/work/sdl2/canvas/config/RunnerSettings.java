package work.sdl2.canvas.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.sdl2.canvas.api.LogLevel;
import work.sdl2.canvas.engine.EngineSettings;
import work.sdl2.canvas.engine.StatusRetryPolicy;

/**
 * Resolved runner configuration: service endpoint, polling, result file and logging.
 */
public record RunnerSettings(
    URI baseUrl,
    Optional<String> apiKey,
    Duration pollInterval,
    Duration maxWait,
    int statusRetries,
    Path resultFile,
    LogLevel logLevel
) {
    public static final URI DEFAULT_BASE_URL = URI.create("http://localhost:8000");
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofHours(1);
    public static final Path DEFAULT_RESULT_FILE = Path.of("result.json");

    public RunnerSettings {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(maxWait, "maxWait");
        Objects.requireNonNull(resultFile, "resultFile");
        Objects.requireNonNull(logLevel, "logLevel");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be greater than zero: " + pollInterval);
        }
        if (maxWait.isNegative()) {
            throw new IllegalArgumentException("Max wait must not be negative: " + maxWait);
        }
        if (statusRetries < 0) {
            throw new IllegalArgumentException("statusRetries must be >= 0");
        }
    }

    public EngineSettings toEngineSettings() {
        return new EngineSettings(pollInterval, maxWait, StatusRetryPolicy.of(statusRetries, pollInterval));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI baseUrl = DEFAULT_BASE_URL;
        private Optional<String> apiKey = Optional.empty();
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration maxWait = DEFAULT_MAX_WAIT;
        private int statusRetries;
        private Path resultFile = DEFAULT_RESULT_FILE;
        private LogLevel logLevel = LogLevel.INFO;

        public Builder baseUrl(URI baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(Optional<String> apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder statusRetries(int statusRetries) {
            this.statusRetries = statusRetries;
            return this;
        }

        public Builder resultFile(Path resultFile) {
            this.resultFile = resultFile;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RunnerSettings build() {
            return new RunnerSettings(baseUrl, apiKey, pollInterval, maxWait, statusRetries, resultFile, logLevel);
        }
    }
}
