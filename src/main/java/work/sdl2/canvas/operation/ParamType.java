package work.sdl2.canvas.operation;

import java.util.List;

/**
 * Value shapes a handler accepts for a resolved parameter.
 */
public enum ParamType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    NUMBER_ARRAY("array<number>");

    private final String label;

    ParamType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case INTEGER -> isIntegral(value);
            case BOOLEAN -> value instanceof Boolean;
            case NUMBER_ARRAY -> value instanceof List<?> list && list.stream().allMatch(item -> item instanceof Number);
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof java.math.BigInteger) {
            return true;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }
}
