package work.sdl2.canvas.error;

import java.util.Map;

public final class MissingParameterException extends WorkflowException {
    private final String paramName;

    public MissingParameterException(String operationId, String paramName) {
        super(
            ErrorCode.MISSING_PARAMETER,
            operationId,
            "Operation " + operationId + " is missing required parameter '" + paramName + "'",
            Map.of("param", paramName),
            null
        );
        this.paramName = paramName;
    }

    public String paramName() {
        return paramName;
    }
}
