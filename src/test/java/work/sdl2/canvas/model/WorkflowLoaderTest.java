package work.sdl2.canvas.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowLoaderTest {
    private static final Path WORKFLOWS = Path.of("src", "test", "resources", "workflows").toAbsolutePath();

    @Test
    void loadsJsonWorkflowWithReferences() {
        var workflow = WorkflowLoader.loadFromLocalFile(WORKFLOWS.resolve("cv-analysis.json"));

        assertEquals("CV_Analysis", workflow.name());
        assertEquals(List.of("cv_operation", "rolling_mean", "peak_detection"),
            workflow.operations().stream().map(Operation::id).toList());
        var csvId = workflow.operations().get(1).params().get("csv_id");
        assertEquals(new ParamValue.Reference("cv_operation", "id"), csvId);
        var range = assertInstanceOf(ParamValue.ArrayValue.class, workflow.operations().get(0).params().get("v_range"));
        assertEquals(2, range.items().size());
    }

    @Test
    void loadsYamlWorkflow() {
        var workflow = WorkflowLoader.loadFromLocalFile(WORKFLOWS.resolve("cv-only.yaml"));

        assertEquals("CV", workflow.name());
        assertEquals(1, workflow.operations().size());
        var operation = workflow.operations().get(0);
        assertEquals("uo_sdl2_cv", operation.type());
        assertEquals(new ParamValue.Literal(0.1), operation.params().get("freq"));
    }

    @Test
    void missingFileIsReported() {
        var error = assertThrows(WorkflowLoadException.class,
            () -> WorkflowLoader.loadFromLocalFile(WORKFLOWS.resolve("does-not-exist.json")));
        assertTrue(error.getMessage().startsWith("Workflow file not found"), error.getMessage());
    }

    @Test
    void nameDefaultsAndOperationsMayBeEmpty(@TempDir Path dir) throws Exception {
        var file = dir.resolve("empty.json");
        Files.writeString(file, "{\"operations\": []}");

        var workflow = WorkflowLoader.loadFromLocalFile(file);

        assertEquals("Unnamed", workflow.name());
        assertTrue(workflow.operations().isEmpty());
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(WorkflowLoadException.class, () -> WorkflowLoader.parseJson("[1, 2]"));
        assertThrows(WorkflowLoadException.class, () -> WorkflowLoader.parseJson("{\"operations\": {}}"));
        assertThrows(WorkflowLoadException.class,
            () -> WorkflowLoader.parseJson("{\"operations\": [{\"type\": \"uo_sdl2_cv\"}]}"));
        assertThrows(WorkflowLoadException.class,
            () -> WorkflowLoader.parseJson("{\"operations\": [{\"id\": \"a\", \"type\": \"uo_sdl2_cv\", \"params\": [1]}]}"));
        assertThrows(WorkflowLoadException.class, () -> WorkflowLoader.parseJson("{not json"));
    }

    @Test
    void duplicateIdsSurviveLoading() {
        var workflow = WorkflowLoader.parseJson("""
            {"name": "dup", "operations": [
              {"id": "x", "type": "uo_sdl2_cv"},
              {"id": "x", "type": "uo_sdl2_cv"}
            ]}
            """);

        assertEquals(2, workflow.operations().size());
    }

    @Test
    void topLevelTypeIsASingleOperationWorkflow() {
        var workflow = WorkflowLoader.parseJson("{\"name\": \"agent\", \"type\": \"uo_sdl2_cv\", \"params\": {\"freq\": 0.2}}");

        assertEquals("agent", workflow.name());
        assertEquals(1, workflow.operations().size());
        var operation = workflow.operations().get(0);
        assertEquals("uo_sdl2_cv", operation.id());
        assertEquals("uo_sdl2_cv", operation.type());
        assertEquals(new ParamValue.Literal(0.2), operation.params().get("freq"));
    }

    @Test
    void documentWithoutOperationsOrTypeIsRejected() {
        var error = assertThrows(WorkflowLoadException.class,
            () -> WorkflowLoader.parseJson("{\"name\": \"typo\", \"operation\": [{\"id\": \"a\", \"type\": \"uo_sdl2_cv\"}]}"));
        assertTrue(error.getMessage().contains("'operations'"), error.getMessage());
        assertThrows(WorkflowLoadException.class, () -> WorkflowLoader.parseJson("{\"name\": \"bare\"}"));
    }
}
