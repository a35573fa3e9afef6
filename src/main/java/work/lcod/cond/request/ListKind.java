package work.lcod.cond.request;

import java.util.Locale;

/**
 * Attribute lists carried by a request.
 */
public enum ListKind {
    REQUEST("request"),
    REPLY("reply"),
    CONTROL("control"),
    SESSION_STATE("session-state");

    private final String label;

    ListKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ListKind from(String value) {
        if (value == null || value.isBlank()) {
            return REQUEST;
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (var kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown attribute list: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
