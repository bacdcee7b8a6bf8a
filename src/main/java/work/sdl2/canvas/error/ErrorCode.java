package work.sdl2.canvas.error;

import java.util.Locale;

/**
 * Machine-readable failure codes recorded in step and workflow results.
 */
public enum ErrorCode {
    DUPLICATE_OPERATION_ID,
    UNSUPPORTED_OPERATION,
    MISSING_PARAMETER,
    INVALID_PARAMETER_TYPE,
    UNKNOWN_REFERENCE,
    INVALID_FIELD_PATH,
    SUBMISSION_FAILED,
    STATUS_QUERY_FAILED,
    RESULT_FETCH_FAILED,
    WAITER_TIMEOUT,
    REMOTE_TASK_FAILED,
    UNEXPECTED_ERROR;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
