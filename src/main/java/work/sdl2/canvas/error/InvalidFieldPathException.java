package work.sdl2.canvas.error;

import java.util.Map;

public final class InvalidFieldPathException extends WorkflowException {
    private final String segment;

    public InvalidFieldPathException(String reference, String segment) {
        super(
            ErrorCode.INVALID_FIELD_PATH,
            null,
            "Referenced path " + reference + " not found (at '" + segment + "')",
            Map.of("reference", reference, "segment", segment),
            null
        );
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}
