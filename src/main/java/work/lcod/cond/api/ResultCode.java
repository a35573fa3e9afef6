package work.lcod.cond.api;

import java.util.Locale;

/**
 * Result code returned by the module that ran before the condition; matched by {@code rcode} nodes.
 */
public enum ResultCode {
    REJECT("reject"),
    FAIL("fail"),
    OK("ok"),
    HANDLED("handled"),
    INVALID("invalid"),
    DISALLOW("disallow"),
    NOTFOUND("notfound"),
    NOOP("noop"),
    UPDATED("updated");

    private final String label;

    ResultCode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ResultCode from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Result code is empty");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var code : values()) {
            if (code.label.equals(normalized)) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unsupported result code: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
