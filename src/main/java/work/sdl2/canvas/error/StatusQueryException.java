package work.sdl2.canvas.error;

import java.util.Map;

public final class StatusQueryException extends WorkflowException {
    public StatusQueryException(String message) {
        this(message, null);
    }

    public StatusQueryException(String message, Throwable cause) {
        super(ErrorCode.STATUS_QUERY_FAILED, null, message, Map.of(), cause);
    }
}
