package work.sdl2.canvas.model;

/**
 * The workflow document could not be read or does not have the expected shape.
 */
public final class WorkflowLoadException extends RuntimeException {
    public WorkflowLoadException(String message) {
        super(message);
    }

    public WorkflowLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
