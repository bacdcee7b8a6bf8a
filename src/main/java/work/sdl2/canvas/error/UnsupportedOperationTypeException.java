package work.sdl2.canvas.error;

import java.util.Map;

/**
 * Raised when an operation declares a {@code type} no handler is registered for.
 */
public final class UnsupportedOperationTypeException extends WorkflowException {
    private final String type;

    public UnsupportedOperationTypeException(String operationId, String type) {
        super(
            ErrorCode.UNSUPPORTED_OPERATION,
            operationId,
            "Unsupported operation type: " + type,
            Map.of("type", String.valueOf(type)),
            null
        );
        this.type = type;
    }

    public String type() {
        return type;
    }
}
