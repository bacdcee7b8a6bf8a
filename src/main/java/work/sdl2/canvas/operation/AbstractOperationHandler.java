package work.sdl2.canvas.operation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.sdl2.canvas.client.RemoteTaskRequest;
import work.sdl2.canvas.error.InvalidParameterTypeException;
import work.sdl2.canvas.error.MissingParameterException;

/**
 * Handler driven by its {@link ParamSpec} list. Parameters that are not declared are not forwarded.
 */
abstract class AbstractOperationHandler implements OperationHandler {
    private final String type;
    private final String remoteKind;
    private final List<ParamSpec> params;

    AbstractOperationHandler(String type, String remoteKind, List<ParamSpec> params) {
        this.type = Objects.requireNonNull(type, "type");
        this.remoteKind = Objects.requireNonNull(remoteKind, "remoteKind");
        this.params = List.copyOf(params);
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String remoteKind() {
        return remoteKind;
    }

    @Override
    public List<ParamSpec> params() {
        return params;
    }

    @Override
    public void validate(String operationId, Map<String, Object> resolvedParams) {
        var values = resolvedParams == null ? Map.<String, Object>of() : resolvedParams;
        for (var spec : params) {
            var value = values.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    throw new MissingParameterException(operationId, spec.name());
                }
                continue;
            }
            if (!spec.type().accepts(value)) {
                throw new InvalidParameterTypeException(operationId, spec.name(), spec.type().label());
            }
        }
    }

    @Override
    public RemoteTaskRequest toRemoteRequest(Map<String, Object> resolvedParams) {
        var values = resolvedParams == null ? Map.<String, Object>of() : resolvedParams;
        var payload = new LinkedHashMap<String, Object>();
        for (var spec : params) {
            var value = values.get(spec.name());
            if (value == null) {
                value = spec.defaultValue();
            }
            if (value != null) {
                payload.put(spec.name(), value);
            }
        }
        return new RemoteTaskRequest(remoteKind, payload);
    }
}
