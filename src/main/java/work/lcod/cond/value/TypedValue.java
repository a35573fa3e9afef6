package work.lcod.cond.value;

import java.net.Inet4Address;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Tagged value used by templates, attributes and comparisons.
 *
 * <p>An <em>owned</em> value was produced during an evaluation (expansion output, cast result) and is
 * released once the comparison step that produced it finishes. Every other value aliases storage owned
 * elsewhere (a literal embedded in a condition tree, an attribute on a request) and is never released by
 * the evaluator.
 */
public final class TypedValue {
    private static final HexFormat HEX = HexFormat.of();

    private final DataType type;
    private final Object payload;
    private final boolean owned;
    private boolean released;

    private TypedValue(DataType type, Object payload, boolean owned) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = checkPayload(type, Objects.requireNonNull(payload, "payload"));
        this.owned = owned;
    }

    public static TypedValue of(DataType type, Object payload) {
        return new TypedValue(type, payload, false);
    }

    public static TypedValue owned(DataType type, Object payload) {
        return new TypedValue(type, payload, true);
    }

    public static TypedValue ofString(String value) {
        return of(DataType.STRING, value);
    }

    public static TypedValue ofLong(DataType type, long value) {
        if (!type.isInteger()) {
            throw new IllegalArgumentException("Not an integer type: " + type);
        }
        return of(type, value);
    }

    public static TypedValue ofBool(boolean value) {
        return of(DataType.BOOL, value);
    }

    public static TypedValue ofOctets(byte[] value) {
        return of(DataType.OCTETS, value.clone());
    }

    public DataType type() {
        return type;
    }

    public boolean owned() {
        return owned;
    }

    public boolean released() {
        return released;
    }

    public Object payload() {
        ensureLive();
        return payload;
    }

    public String stringValue() {
        ensureType(DataType.STRING);
        return (String) payload;
    }

    public long longValue() {
        ensureLive();
        if (!type.isInteger()) {
            throw new IllegalStateException("Value of type " + type + " is not an integer");
        }
        return (Long) payload;
    }

    public boolean boolValue() {
        ensureType(DataType.BOOL);
        return (Boolean) payload;
    }

    public double doubleValue() {
        ensureType(DataType.FLOAT64);
        return (Double) payload;
    }

    public byte[] octets() {
        ensureType(DataType.OCTETS);
        return ((byte[]) payload).clone();
    }

    public Inet4Address addressValue() {
        ensureType(DataType.IPV4_ADDR);
        return (Inet4Address) payload;
    }

    public Instant dateValue() {
        ensureType(DataType.DATE);
        return (Instant) payload;
    }

    /**
     * Length in bytes of the value's wire form (UTF-8 for strings).
     */
    public int length() {
        ensureLive();
        return switch (type) {
            case STRING -> ((String) payload).getBytes(StandardCharsets.UTF_8).length;
            case OCTETS -> ((byte[]) payload).length;
            case BOOL, UINT8 -> 1;
            case UINT16 -> 2;
            case UINT32, INT32, IPV4_ADDR, DATE -> 4;
            case UINT64, INT64, FLOAT64 -> 8;
        };
    }

    /**
     * Returns an owned copy; octet payloads are duplicated so releasing the copy never touches the source.
     */
    public TypedValue copy() {
        ensureLive();
        Object duplicate = type == DataType.OCTETS ? ((byte[]) payload).clone() : payload;
        return new TypedValue(type, duplicate, true);
    }

    /**
     * Releases an owned value. Octet payloads are wiped. Aliased values are left untouched.
     */
    public void release() {
        if (!owned || released) {
            return;
        }
        if (payload instanceof byte[] bytes) {
            Arrays.fill(bytes, (byte) 0);
        }
        released = true;
    }

    /**
     * Printable form used by expansions and diagnostics.
     */
    public String print() {
        ensureLive();
        return switch (type) {
            case STRING -> (String) payload;
            case OCTETS -> "0x" + HEX.formatHex((byte[]) payload);
            case BOOL -> (Boolean) payload ? "yes" : "no";
            case UINT64 -> Long.toUnsignedString((Long) payload);
            case UINT8, UINT16, UINT32, INT32, INT64 -> Long.toString((Long) payload);
            case FLOAT64 -> Double.toString((Double) payload);
            case IPV4_ADDR -> ((Inet4Address) payload).getHostAddress();
            case DATE -> payload.toString();
        };
    }

    private void ensureType(DataType expected) {
        ensureLive();
        if (type != expected) {
            throw new IllegalStateException("Value of type " + type + " is not " + expected);
        }
    }

    private void ensureLive() {
        if (released) {
            throw new IllegalStateException("Value of type " + type + " was already released");
        }
    }

    private static Object checkPayload(DataType type, Object payload) {
        Class<?> expected = switch (type) {
            case STRING -> String.class;
            case OCTETS -> byte[].class;
            case BOOL -> Boolean.class;
            case UINT8, UINT16, UINT32, UINT64, INT32, INT64 -> Long.class;
            case FLOAT64 -> Double.class;
            case IPV4_ADDR -> Inet4Address.class;
            case DATE -> Instant.class;
        };
        if (!expected.isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName() + " does not match type " + type);
        }
        return payload;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof TypedValue that)) return false;
        if (type != that.type) return false;
        if (payload instanceof byte[] bytes) {
            return Arrays.equals(bytes, (byte[]) that.payload);
        }
        return payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        int payloadHash = payload instanceof byte[] bytes ? Arrays.hashCode(bytes) : payload.hashCode();
        return 31 * type.hashCode() + payloadHash;
    }

    @Override
    public String toString() {
        if (released) {
            return type + ":<released>";
        }
        return type + ":" + print();
    }
}
