package work.sdl2.canvas.error;

import java.util.Map;

public final class ResultFetchException extends WorkflowException {
    public ResultFetchException(String message) {
        this(message, null);
    }

    public ResultFetchException(String message, Throwable cause) {
        super(ErrorCode.RESULT_FETCH_FAILED, null, message, Map.of(), cause);
    }
}
