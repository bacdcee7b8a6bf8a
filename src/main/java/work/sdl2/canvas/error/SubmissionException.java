package work.sdl2.canvas.error;

import java.util.Map;

public final class SubmissionException extends WorkflowException {
    public SubmissionException(String message) {
        this(message, null);
    }

    public SubmissionException(String message, Throwable cause) {
        super(ErrorCode.SUBMISSION_FAILED, null, message, Map.of(), cause);
    }
}
