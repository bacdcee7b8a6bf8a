package work.sdl2.canvas.operation;

import java.util.List;
import java.util.Map;
import work.sdl2.canvas.client.RemoteTaskRequest;
import work.sdl2.canvas.error.InvalidParameterTypeException;
import work.sdl2.canvas.error.MissingParameterException;

/**
 * Capability shared by every operation type: check resolved parameters and map them onto a remote task.
 */
public interface OperationHandler {
    /** Workflow-level type string, e.g. {@code uo_sdl2_cv}. */
    String type();

    /** Task kind used in the submission path. */
    String remoteKind();

    List<ParamSpec> params();

    /**
     * @throws MissingParameterException when a required parameter is absent or null
     * @throws InvalidParameterTypeException when a present parameter has the wrong shape
     */
    void validate(String operationId, Map<String, Object> resolvedParams);

    /**
     * Pure mapping from validated parameters to the request body; defaults are filled in here.
     */
    RemoteTaskRequest toRemoteRequest(Map<String, Object> resolvedParams);
}
