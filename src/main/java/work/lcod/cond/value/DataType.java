package work.lcod.cond.value;

import java.util.Locale;
import java.util.Map;

/**
 * Value types known to the dictionary and the comparison primitives.
 */
public enum DataType {
    STRING("string"),
    OCTETS("octets"),
    BOOL("bool"),
    UINT8("uint8"),
    UINT16("uint16"),
    UINT32("uint32"),
    UINT64("uint64"),
    INT32("int32"),
    INT64("int64"),
    FLOAT64("float64"),
    IPV4_ADDR("ipaddr"),
    DATE("date");

    private static final Map<String, DataType> BY_NAME = Map.ofEntries(
        Map.entry("string", STRING),
        Map.entry("octets", OCTETS),
        Map.entry("bool", BOOL),
        Map.entry("boolean", BOOL),
        Map.entry("uint8", UINT8),
        Map.entry("byte", UINT8),
        Map.entry("uint16", UINT16),
        Map.entry("short", UINT16),
        Map.entry("uint32", UINT32),
        Map.entry("integer", UINT32),
        Map.entry("uint64", UINT64),
        Map.entry("integer64", UINT64),
        Map.entry("int32", INT32),
        Map.entry("signed", INT32),
        Map.entry("int64", INT64),
        Map.entry("float64", FLOAT64),
        Map.entry("ipaddr", IPV4_ADDR),
        Map.entry("ipv4addr", IPV4_ADDR),
        Map.entry("date", DATE)
    );

    private final String label;

    DataType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isInteger() {
        return switch (this) {
            case UINT8, UINT16, UINT32, UINT64, INT32, INT64 -> true;
            case STRING, OCTETS, BOOL, FLOAT64, IPV4_ADDR, DATE -> false;
        };
    }

    public boolean isNumeric() {
        return isInteger() || this == FLOAT64;
    }

    public static DataType fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Data type name is empty");
        }
        var type = BY_NAME.get(value.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new IllegalArgumentException("Unsupported data type: " + value);
        }
        return type;
    }

    @Override
    public String toString() {
        return label;
    }
}
