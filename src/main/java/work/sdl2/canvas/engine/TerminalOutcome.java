package work.sdl2.canvas.engine;

import java.util.Objects;

/**
 * How a wait on a remote task ended and how many status queries it took.
 */
public record TerminalOutcome(Kind kind, String errorDetail, int polls) {
    public TerminalOutcome {
        Objects.requireNonNull(kind, "kind");
    }

    static TerminalOutcome succeeded(int polls) {
        return new TerminalOutcome(Kind.SUCCEEDED, null, polls);
    }

    static TerminalOutcome failed(String errorDetail, int polls) {
        return new TerminalOutcome(Kind.FAILED, errorDetail, polls);
    }

    static TerminalOutcome timedOut(String detail, int polls) {
        return new TerminalOutcome(Kind.TIMED_OUT, detail, polls);
    }

    public enum Kind {
        SUCCEEDED,
        FAILED,
        TIMED_OUT
    }
}
