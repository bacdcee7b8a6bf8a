package work.sdl2.canvas.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdl2.canvas.engine.WorkflowResult;

/**
 * Persists a {@link WorkflowResult} as pretty-printed JSON.
 */
public final class WorkflowResultWriter {
    private static final Logger log = LoggerFactory.getLogger(WorkflowResultWriter.class);
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private WorkflowResultWriter() {}

    public static String toJson(WorkflowResult result) {
        try {
            return WRITER.writeValueAsString(result.toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize workflow result: " + ex.getMessage(), ex);
        }
    }

    public static void write(WorkflowResult result, Path target) {
        try {
            var parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(result));
            log.info("Saved results to {}", target);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write result file: " + target, ex);
        }
    }
}
