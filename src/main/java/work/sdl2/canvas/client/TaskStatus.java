package work.sdl2.canvas.client;

import java.util.Objects;

/**
 * Snapshot of a remote task's state. {@code errorDetail} is only set for failed tasks.
 */
public record TaskStatus(RemoteStatus status, String errorDetail) {
    public TaskStatus {
        Objects.requireNonNull(status, "status");
    }

    public static TaskStatus of(RemoteStatus status) {
        return new TaskStatus(status, null);
    }

    public static TaskStatus failed(String errorDetail) {
        return new TaskStatus(RemoteStatus.FAILED, errorDetail);
    }
}
