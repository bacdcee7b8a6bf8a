package work.sdl2.canvas.engine;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdl2.canvas.client.RemoteStatus;
import work.sdl2.canvas.client.RemoteTaskClient;
import work.sdl2.canvas.client.TaskStatus;
import work.sdl2.canvas.error.StatusQueryException;

/**
 * Polls a submitted task until it reaches a terminal state or the per-step deadline elapses.
 *
 * <p>The first status query happens immediately and starts the clock. While the task is pending or
 * running and less than {@code maxWait} has elapsed, the waiter sleeps {@code pollInterval} and asks
 * again. Giving up produces {@link TerminalOutcome.Kind#TIMED_OUT}; the remote task is left alone.
 */
public final class CompletionWaiter {
    static final String CANCELLED_DETAIL = "cancelled";

    private static final Logger log = LoggerFactory.getLogger(CompletionWaiter.class);

    private final RemoteTaskClient client;
    private final WaitClock clock;

    public CompletionWaiter(RemoteTaskClient client) {
        this(client, WaitClock.SYSTEM);
    }

    public CompletionWaiter(RemoteTaskClient client, WaitClock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TerminalOutcome await(String taskId, Duration pollInterval, Duration maxWait) {
        return await(taskId, pollInterval, maxWait, StatusRetryPolicy.NONE, new CancellationToken(), status -> {});
    }

    /**
     * @throws StatusQueryException when a status query fails and the retry policy is exhausted
     */
    public TerminalOutcome await(
        String taskId,
        Duration pollInterval,
        Duration maxWait,
        StatusRetryPolicy retry,
        CancellationToken token,
        Consumer<RemoteStatus> onStatus
    ) {
        log.info("Waiting for task {} to complete...", taskId);
        long maxWaitNanos = maxWait.toNanos();
        long start = clock.nanoTime();
        int polls = 0;
        while (true) {
            if (token.isCancelled()) {
                log.warn("Stopped waiting for task {}: cancelled", taskId);
                return TerminalOutcome.timedOut(CANCELLED_DETAIL, polls);
            }
            var queried = queryStatus(taskId, retry, token);
            if (queried.isEmpty()) {
                log.warn("Stopped waiting for task {}: cancelled during status retry", taskId);
                return TerminalOutcome.timedOut(CANCELLED_DETAIL, polls);
            }
            var status = queried.get();
            polls++;
            log.debug("Task {} status: {}", taskId, status.status());
            onStatus.accept(status.status());
            if (status.status() == RemoteStatus.SUCCEEDED) {
                log.info("Task {} completed successfully", taskId);
                return TerminalOutcome.succeeded(polls);
            }
            if (status.status() == RemoteStatus.FAILED) {
                log.warn("Task {} failed: {}", taskId, status.errorDetail());
                return TerminalOutcome.failed(status.errorDetail(), polls);
            }
            long elapsed = clock.nanoTime() - start;
            if (elapsed >= maxWaitNanos) {
                log.warn("Task {} did not complete within {}", taskId, maxWait);
                return TerminalOutcome.timedOut("Task " + taskId + " did not complete within " + maxWait, polls);
            }
            if (!pause(pollInterval)) {
                log.warn("Stopped waiting for task {}: interrupted", taskId);
                return TerminalOutcome.timedOut(CANCELLED_DETAIL, polls);
            }
        }
    }

    /**
     * Empty when the wait was cancelled or interrupted between retries.
     */
    private Optional<TaskStatus> queryStatus(String taskId, StatusRetryPolicy retry, CancellationToken token) {
        int attempt = 0;
        while (true) {
            try {
                return Optional.of(client.getStatus(taskId));
            } catch (StatusQueryException ex) {
                if (attempt >= retry.maxRetries()) {
                    throw ex;
                }
                var backoff = retry.backoff(attempt);
                attempt++;
                log.warn("Status query for task {} failed ({}), retry {}/{} in {}", taskId, ex.getMessage(), attempt, retry.maxRetries(), backoff);
                if (!pause(backoff) || token.isCancelled()) {
                    return Optional.empty();
                }
            }
        }
    }

    private boolean pause(Duration duration) {
        try {
            clock.sleep(duration);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
