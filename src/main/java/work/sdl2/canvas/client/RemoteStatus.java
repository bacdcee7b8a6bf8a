package work.sdl2.canvas.client;

import java.util.Locale;

/**
 * Status reported by the remote task service.
 */
public enum RemoteStatus {
    PENDING(0),
    SUCCEEDED(1),
    RUNNING(2),
    FAILED(3);

    private final int code;

    RemoteStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * Accepts the status names (plus the {@code COMPLETED}/{@code ERROR} aliases) or the numeric codes
     * older service versions send.
     */
    public static RemoteStatus from(Object raw) {
        if (raw instanceof Number number) {
            // exact comparison: 1.9 or 2^32 + 1 must not alias a code
            double value = number.doubleValue();
            for (var status : values()) {
                if (status.code == value) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown task status: " + raw);
        }
        if (raw instanceof String str && !str.isBlank()) {
            var normalized = str.trim().toUpperCase(Locale.ROOT);
            if ("COMPLETED".equals(normalized)) {
                return SUCCEEDED;
            }
            if ("ERROR".equals(normalized)) {
                return FAILED;
            }
            if (normalized.chars().allMatch(Character::isDigit)) {
                return from(Integer.parseInt(normalized));
            }
            try {
                return valueOf(normalized);
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unknown task status: " + raw);
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
