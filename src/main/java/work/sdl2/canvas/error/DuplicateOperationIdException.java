package work.sdl2.canvas.error;

import java.util.Map;

public final class DuplicateOperationIdException extends WorkflowException {
    public DuplicateOperationIdException(String operationId) {
        super(
            ErrorCode.DUPLICATE_OPERATION_ID,
            operationId,
            "Operation id is declared more than once: " + operationId,
            Map.of(),
            null
        );
    }
}
