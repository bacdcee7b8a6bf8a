package work.sdl2.canvas.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base type for every failure the workflow core raises. Carries an {@link ErrorCode}, the operation
 * being processed (when known) and optional structured details for the result document.
 */
public class WorkflowException extends RuntimeException {
    private final ErrorCode code;
    private final String operationId;
    private final Map<String, Object> details;

    public WorkflowException(ErrorCode code, String operationId, String message) {
        this(code, operationId, message, Map.of(), null);
    }

    public WorkflowException(ErrorCode code, String operationId, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.operationId = operationId;
        this.details = details == null ? Map.of() : new LinkedHashMap<>(details);
    }

    public ErrorCode code() {
        return code;
    }

    public String operationId() {
        return operationId;
    }

    public Map<String, Object> details() {
        return details;
    }
}
