package work.sdl2.canvas.engine;

/**
 * Lets a caller stop a running workflow. The in-flight step is recorded as timed out and no remote
 * cancellation is issued.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
