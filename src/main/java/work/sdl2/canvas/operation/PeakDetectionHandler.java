package work.sdl2.canvas.operation;

import java.util.List;

/**
 * Peak detection over a stored CSV. Only {@code prominence} has a default among the detection thresholds.
 */
public final class PeakDetectionHandler extends AbstractOperationHandler {
    public static final String TYPE = "uo_sdl2_peak_detection";

    public PeakDetectionHandler() {
        super(TYPE, "peak_detection", List.of(
            ParamSpec.required("csv_id", ParamType.STRING),
            ParamSpec.optional("x_col", ParamType.STRING, "voltage"),
            ParamSpec.optional("y_col", ParamType.STRING, "current"),
            ParamSpec.optional("prominence", ParamType.NUMBER, 0.02),
            ParamSpec.optional("height", ParamType.NUMBER),
            ParamSpec.optional("distance", ParamType.NUMBER),
            ParamSpec.optional("width", ParamType.NUMBER),
            ParamSpec.optional("threshold", ParamType.NUMBER)
        ));
    }
}
