package work.lcod.cond.value;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import work.lcod.cond.dict.AttributeDef;

/**
 * Default conversion and comparison rules for every {@link DataType}.
 *
 * <p>Strings compare byte-wise on their UTF-8 form, {@code uint64} compares unsigned, and {@code bool}
 * only supports equality.
 */
public final class StandardValueOps implements ValueOps {
    private static final HexFormat HEX = HexFormat.of();

    @Override
    public TypedValue cast(TypedValue value, DataType target, AttributeDef context) throws CastException {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(target, "target");
        var source = value.type();
        if (source == target) {
            return value;
        }
        if (source == DataType.STRING) {
            return fromString(value.stringValue(), target, context);
        }
        if (target == DataType.STRING) {
            var text = source == DataType.OCTETS
                ? new String(value.octets(), StandardCharsets.UTF_8)
                : value.print();
            return TypedValue.owned(DataType.STRING, text);
        }
        if (target == DataType.OCTETS) {
            return TypedValue.owned(DataType.OCTETS, toOctets(value));
        }
        if (source == DataType.OCTETS) {
            return fromOctets(value.octets(), target);
        }
        if (source.isInteger() && target.isInteger()) {
            return TypedValue.owned(target, checkRange(value.longValue(), source, target));
        }
        return convertScalar(value, target);
    }

    @Override
    public boolean applyOperator(Operator op, TypedValue left, TypedValue right) throws CastException {
        Objects.requireNonNull(op, "op");
        if (op == Operator.REG_EQ) {
            throw new CastException("Operator =~ cannot be applied to plain values");
        }
        if (left.type() != right.type()) {
            throw new CastException("Cannot compare " + left.type() + " with " + right.type());
        }
        if (left.type() == DataType.BOOL && op.isOrdering()) {
            throw new CastException("Operator " + op + " is not defined for bool");
        }
        return op.test(compare(left, right));
    }

    private static int compare(TypedValue left, TypedValue right) {
        return switch (left.type()) {
            case STRING -> Arrays.compareUnsigned(
                left.stringValue().getBytes(StandardCharsets.UTF_8),
                right.stringValue().getBytes(StandardCharsets.UTF_8));
            case OCTETS -> Arrays.compareUnsigned(left.octets(), right.octets());
            case BOOL -> Boolean.compare(left.boolValue(), right.boolValue());
            case UINT64 -> Long.compareUnsigned(left.longValue(), right.longValue());
            case UINT8, UINT16, UINT32, INT32, INT64 -> Long.compare(left.longValue(), right.longValue());
            case FLOAT64 -> Double.compare(left.doubleValue(), right.doubleValue());
            case IPV4_ADDR -> Integer.compareUnsigned(addressBits(left.addressValue()), addressBits(right.addressValue()));
            case DATE -> left.dateValue().compareTo(right.dateValue());
        };
    }

    private static TypedValue fromString(String text, DataType target, AttributeDef context) throws CastException {
        var trimmed = text.trim();
        return switch (target) {
            case STRING -> TypedValue.owned(DataType.STRING, text);
            case OCTETS -> TypedValue.owned(DataType.OCTETS, parseOctets(text));
            case BOOL -> TypedValue.owned(DataType.BOOL, parseBool(trimmed));
            case UINT8, UINT16, UINT32, UINT64, INT32, INT64 -> TypedValue.owned(target, parseInteger(trimmed, target, context));
            case FLOAT64 -> TypedValue.owned(DataType.FLOAT64, parseDouble(trimmed));
            case IPV4_ADDR -> TypedValue.owned(DataType.IPV4_ADDR, parseIpv4(trimmed));
            case DATE -> TypedValue.owned(DataType.DATE, parseDate(trimmed));
        };
    }

    private static byte[] parseOctets(String text) throws CastException {
        if (text.length() > 1 && (text.startsWith("0x") || text.startsWith("0X"))) {
            try {
                return HEX.parseHex(text.substring(2));
            } catch (IllegalArgumentException ex) {
                throw new CastException("Invalid hex string \"" + text + "\"", ex);
            }
        }
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static boolean parseBool(String text) throws CastException {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "yes", "true", "on", "1":
                return true;
            case "no", "false", "off", "0":
                return false;
            default:
                throw new CastException("Invalid bool value \"" + text + "\"");
        }
    }

    private static long parseInteger(String text, DataType target, AttributeDef context) throws CastException {
        if (context != null) {
            var named = context.valueOf(text);
            if (named.isPresent()) {
                return checkRange(named.getAsLong(), DataType.INT64, target);
            }
        }
        try {
            if (text.length() > 2 && (text.startsWith("0x") || text.startsWith("0X"))) {
                return checkRange(Long.parseUnsignedLong(text.substring(2), 16), DataType.UINT64, target);
            }
            if (target == DataType.UINT64 && !text.startsWith("-")) {
                return Long.parseUnsignedLong(text);
            }
            return checkRange(Long.parseLong(text), DataType.INT64, target);
        } catch (NumberFormatException ex) {
            throw new CastException("Invalid " + target + " value \"" + text + "\"", ex);
        }
    }

    private static double parseDouble(String text) throws CastException {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw new CastException("Invalid float64 value \"" + text + "\"", ex);
        }
    }

    private static Inet4Address parseIpv4(String text) throws CastException {
        var parts = text.split("\\.", -1);
        if (parts.length != 4) {
            throw new CastException("Invalid IPv4 address \"" + text + "\"");
        }
        var bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            var part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                throw new CastException("Invalid IPv4 address \"" + text + "\"");
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                throw new CastException("Invalid IPv4 address \"" + text + "\"");
            }
            bytes[i] = (byte) octet;
        }
        return address(bytes);
    }

    private static Instant parseDate(String text) throws CastException {
        try {
            if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochSecond(Long.parseLong(text));
            }
            return Instant.parse(text);
        } catch (DateTimeException | NumberFormatException ex) {
            throw new CastException("Invalid date value \"" + text + "\"", ex);
        }
    }

    private static byte[] toOctets(TypedValue value) {
        return switch (value.type()) {
            case STRING -> value.stringValue().getBytes(StandardCharsets.UTF_8);
            case OCTETS -> value.octets();
            case BOOL -> new byte[] { (byte) (value.boolValue() ? 1 : 0) };
            case UINT8 -> new byte[] { (byte) value.longValue() };
            case UINT16 -> ByteBuffer.allocate(2).putShort((short) value.longValue()).array();
            case UINT32, INT32 -> ByteBuffer.allocate(4).putInt((int) value.longValue()).array();
            case UINT64, INT64 -> ByteBuffer.allocate(8).putLong(value.longValue()).array();
            case FLOAT64 -> ByteBuffer.allocate(8).putDouble(value.doubleValue()).array();
            case IPV4_ADDR -> value.addressValue().getAddress();
            case DATE -> ByteBuffer.allocate(4).putInt((int) value.dateValue().getEpochSecond()).array();
        };
    }

    private static TypedValue fromOctets(byte[] bytes, DataType target) throws CastException {
        int expected = wireLength(target);
        if (bytes.length != expected) {
            throw new CastException("Cannot cast " + bytes.length + " octets to " + target + " (needs " + expected + ")");
        }
        var buffer = ByteBuffer.wrap(bytes);
        Object payload = switch (target) {
            case BOOL -> bytes[0] != 0;
            case UINT8 -> (long) (bytes[0] & 0xFF);
            case UINT16 -> (long) (buffer.getShort() & 0xFFFF);
            case UINT32 -> buffer.getInt() & 0xFFFFFFFFL;
            case INT32 -> (long) buffer.getInt();
            case UINT64, INT64 -> buffer.getLong();
            case FLOAT64 -> buffer.getDouble();
            case IPV4_ADDR -> address(bytes);
            case DATE -> Instant.ofEpochSecond(buffer.getInt() & 0xFFFFFFFFL);
            case STRING, OCTETS -> throw new CastException("Unexpected octets target " + target);
        };
        return TypedValue.owned(target, payload);
    }

    private static int wireLength(DataType type) {
        return switch (type) {
            case BOOL, UINT8 -> 1;
            case UINT16 -> 2;
            case UINT32, INT32, IPV4_ADDR, DATE -> 4;
            case UINT64, INT64, FLOAT64 -> 8;
            case STRING, OCTETS -> -1;
        };
    }

    private static TypedValue convertScalar(TypedValue value, DataType target) throws CastException {
        var source = value.type();
        switch (target) {
            case BOOL:
                if (source.isInteger() && (value.longValue() == 0 || value.longValue() == 1)) {
                    return TypedValue.owned(DataType.BOOL, value.longValue() == 1);
                }
                break;
            case UINT8, UINT16, UINT32, UINT64, INT32, INT64:
                if (source == DataType.BOOL) {
                    return TypedValue.owned(target, value.boolValue() ? 1L : 0L);
                }
                if (source == DataType.FLOAT64) {
                    double d = value.doubleValue();
                    long l = (long) d;
                    if (Double.isFinite(d) && l == d) {
                        return TypedValue.owned(target, checkRange(l, DataType.INT64, target));
                    }
                    throw new CastException("float64 value " + d + " is not integral");
                }
                if (source == DataType.IPV4_ADDR) {
                    long bits = addressBits(value.addressValue()) & 0xFFFFFFFFL;
                    return TypedValue.owned(target, checkRange(bits, DataType.UINT32, target));
                }
                if (source == DataType.DATE) {
                    return TypedValue.owned(target, checkRange(value.dateValue().getEpochSecond(), DataType.INT64, target));
                }
                break;
            case FLOAT64:
                if (source.isInteger()) {
                    double d = source == DataType.UINT64
                        ? Double.parseDouble(Long.toUnsignedString(value.longValue()))
                        : (double) value.longValue();
                    return TypedValue.owned(DataType.FLOAT64, d);
                }
                break;
            case IPV4_ADDR:
                if (source.isInteger()) {
                    long bits = checkRange(value.longValue(), source, DataType.UINT32);
                    return TypedValue.owned(DataType.IPV4_ADDR, address(ByteBuffer.allocate(4).putInt((int) bits).array()));
                }
                break;
            case DATE:
                if (source.isInteger()) {
                    long seconds = checkRange(value.longValue(), source, DataType.INT64);
                    return TypedValue.owned(DataType.DATE, Instant.ofEpochSecond(seconds));
                }
                break;
            default:
                break;
        }
        throw new CastException("Cannot cast " + source + " to " + target);
    }

    private static long checkRange(long value, DataType source, DataType target) throws CastException {
        if (source == DataType.UINT64 && value < 0) {
            if (target == DataType.UINT64) {
                return value;
            }
            throw outOfRange(Long.toUnsignedString(value), target);
        }
        boolean inRange = switch (target) {
            case UINT8 -> value >= 0 && value <= 0xFFL;
            case UINT16 -> value >= 0 && value <= 0xFFFFL;
            case UINT32 -> value >= 0 && value <= 0xFFFFFFFFL;
            case UINT64 -> value >= 0;
            case INT32 -> value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            case INT64 -> true;
            case STRING, OCTETS, BOOL, FLOAT64, IPV4_ADDR, DATE -> false;
        };
        if (!inRange) {
            throw outOfRange(Long.toString(value), target);
        }
        return value;
    }

    private static CastException outOfRange(String printed, DataType target) {
        return new CastException("Value " + printed + " is out of range for " + target);
    }

    private static int addressBits(Inet4Address address) {
        return ByteBuffer.wrap(address.getAddress()).getInt();
    }

    private static Inet4Address address(byte[] bytes) throws CastException {
        try {
            return (Inet4Address) InetAddress.getByAddress(bytes);
        } catch (UnknownHostException ex) {
            throw new CastException("Invalid IPv4 address bytes", ex);
        }
    }
}
