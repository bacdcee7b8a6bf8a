package work.sdl2.canvas.error;

import java.util.Map;

public final class InvalidParameterTypeException extends WorkflowException {
    private final String paramName;
    private final String expectedType;

    public InvalidParameterTypeException(String operationId, String paramName, String expectedType) {
        super(
            ErrorCode.INVALID_PARAMETER_TYPE,
            operationId,
            "Operation " + operationId + " expects parameter '" + paramName + "' of type " + expectedType,
            Map.of("param", paramName, "expectedType", expectedType),
            null
        );
        this.paramName = paramName;
        this.expectedType = expectedType;
    }

    public String paramName() {
        return paramName;
    }

    public String expectedType() {
        return expectedType;
    }
}
