package work.sdl2.canvas.error;

import java.util.Map;

/**
 * A reference names an operation that has not produced an output yet (never declared, declared later,
 * or did not succeed).
 */
public final class UnknownReferenceException extends WorkflowException {
    private final String referencedId;

    public UnknownReferenceException(String reference, String referencedId) {
        super(
            ErrorCode.UNKNOWN_REFERENCE,
            null,
            "Referenced operation " + referencedId + " not found or not executed yet",
            Map.of("reference", reference, "referencedId", referencedId),
            null
        );
        this.referencedId = referencedId;
    }

    public String referencedId() {
        return referencedId;
    }
}
