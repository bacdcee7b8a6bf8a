package work.sdl2.canvas.operation;

import java.util.List;
import java.util.Map;
import work.sdl2.canvas.error.InvalidParameterTypeException;

/**
 * Cyclic voltammetry run: sweeps {@code v_range} at {@code freq}.
 */
public final class CyclicVoltammetryHandler extends AbstractOperationHandler {
    public static final String TYPE = "uo_sdl2_cv";

    public CyclicVoltammetryHandler() {
        super(TYPE, "cv", List.of(
            ParamSpec.optional("v_range", ParamType.NUMBER_ARRAY, List.of(-0.5, 0.5)),
            ParamSpec.optional("freq", ParamType.NUMBER, 0.1)
        ));
    }

    @Override
    public void validate(String operationId, Map<String, Object> resolvedParams) {
        super.validate(operationId, resolvedParams);
        if (resolvedParams != null && resolvedParams.get("v_range") instanceof List<?> range && range.size() != 2) {
            throw new InvalidParameterTypeException(operationId, "v_range", "array<number> of length 2");
        }
    }
}
