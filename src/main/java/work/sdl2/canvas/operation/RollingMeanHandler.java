package work.sdl2.canvas.operation;

import java.util.List;

public final class RollingMeanHandler extends AbstractOperationHandler {
    public static final String TYPE = "uo_sdl2_rolling_mean";

    public RollingMeanHandler() {
        super(TYPE, "rolling_mean", List.of(
            ParamSpec.required("csv_id", ParamType.STRING),
            ParamSpec.optional("x_col", ParamType.STRING, "time"),
            ParamSpec.optional("y_col", ParamType.STRING, "current"),
            ParamSpec.optional("window_size", ParamType.INTEGER, 20),
            ParamSpec.optional("min_periods", ParamType.INTEGER)
        ));
    }
}
