package work.lcod.cond.value;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.cond.dict.AttributeDef;

class StandardValueOpsTest {
    private final StandardValueOps ops = new StandardValueOps();

    @Test
    void castToSameTypeReturnsTheValue() throws Exception {
        var value = TypedValue.ofString("bob");
        assertSame(value, ops.cast(value, DataType.STRING, null));
    }

    @Test
    void castsStringsToIntegers() throws Exception {
        var cast = ops.cast(TypedValue.ofString("010"), DataType.UINT32, null);
        assertEquals(10L, cast.longValue());
        assertTrue(cast.owned());

        assertEquals(255L, ops.cast(TypedValue.ofString("0xff"), DataType.UINT8, null).longValue());
        assertEquals(-5L, ops.cast(TypedValue.ofString("-5"), DataType.INT32, null).longValue());
        assertEquals("18446744073709551615",
            ops.cast(TypedValue.ofString("18446744073709551615"), DataType.UINT64, null).print());
    }

    @Test
    void rejectsOutOfRangeIntegers() {
        assertThrows(CastException.class, () -> ops.cast(TypedValue.ofString("256"), DataType.UINT8, null));
        assertThrows(CastException.class, () -> ops.cast(TypedValue.ofString("-1"), DataType.UINT32, null));
        assertThrows(CastException.class, () -> ops.cast(TypedValue.ofLong(DataType.UINT32, 70000L), DataType.UINT16, null));
        assertThrows(CastException.class, () -> ops.cast(TypedValue.ofString("ten"), DataType.UINT32, null));
    }

    @Test
    void resolvesEnumeratedNamesThroughTheContext() throws Exception {
        var serviceType = AttributeDef.of("Service-Type", DataType.UINT32).withValues(Map.of("Framed-User", 2L));

        assertEquals(2L, ops.cast(TypedValue.ofString("framed-user"), DataType.UINT32, serviceType).longValue());
        assertThrows(CastException.class, () -> ops.cast(TypedValue.ofString("Framed-User"), DataType.UINT32, null));
    }

    @Test
    void castsStringsToOtherScalars() throws Exception {
        assertTrue(ops.cast(TypedValue.ofString("yes"), DataType.BOOL, null).boolValue());
        assertFalse(ops.cast(TypedValue.ofString("off"), DataType.BOOL, null).boolValue());
        assertEquals("192.0.2.1", ops.cast(TypedValue.ofString("192.0.2.1"), DataType.IPV4_ADDR, null).print());
        assertEquals(Instant.ofEpochSecond(60), ops.cast(TypedValue.ofString("60"), DataType.DATE, null).dateValue());
        assertEquals(Instant.parse("2024-01-02T03:04:05Z"),
            ops.cast(TypedValue.ofString("2024-01-02T03:04:05Z"), DataType.DATE, null).dateValue());
        assertArrayEquals(new byte[] { 1, 2 }, ops.cast(TypedValue.ofString("0x0102"), DataType.OCTETS, null).octets());
        assertThrows(CastException.class, () -> ops.cast(TypedValue.ofString("192.0.2.256"), DataType.IPV4_ADDR, null));
        assertThrows(CastException.class, () -> ops.cast(TypedValue.ofString("maybe"), DataType.BOOL, null));
    }

    @Test
    void castsBetweenOctetsAndFixedWidthTypes() throws Exception {
        var bytes = TypedValue.ofOctets(new byte[] { 0, 0, 1, 0 });
        assertEquals(256L, ops.cast(bytes, DataType.UINT32, null).longValue());
        assertArrayEquals(new byte[] { 0, 0, 1, 0 },
            ops.cast(TypedValue.ofLong(DataType.UINT32, 256L), DataType.OCTETS, null).octets());
        assertThrows(CastException.class, () -> ops.cast(bytes, DataType.UINT16, null));
    }

    @Test
    void printsValuesWhenCastToString() throws Exception {
        assertEquals("42", ops.cast(TypedValue.ofLong(DataType.UINT32, 42L), DataType.STRING, null).stringValue());
        assertEquals("yes", ops.cast(TypedValue.ofBool(true), DataType.STRING, null).stringValue());
    }

    @Test
    void appliesOrderingOperators() throws Exception {
        var one = TypedValue.ofLong(DataType.UINT32, 1L);
        var two = TypedValue.ofLong(DataType.UINT32, 2L);

        assertTrue(ops.applyOperator(Operator.LT, one, two));
        assertTrue(ops.applyOperator(Operator.LE, one, one));
        assertFalse(ops.applyOperator(Operator.GT, one, two));
        assertTrue(ops.applyOperator(Operator.NE, one, two));
        assertTrue(ops.applyOperator(Operator.GE, two, one));
    }

    @Test
    void comparesUnsignedValuesAsUnsigned() throws Exception {
        var big = TypedValue.ofLong(DataType.UINT64, -1L);
        var small = TypedValue.ofLong(DataType.UINT64, 1L);
        assertTrue(ops.applyOperator(Operator.GT, big, small));

        var high = ops.cast(TypedValue.ofString("200.0.0.1"), DataType.IPV4_ADDR, null);
        var low = ops.cast(TypedValue.ofString("10.0.0.1"), DataType.IPV4_ADDR, null);
        assertTrue(ops.applyOperator(Operator.GT, high, low));
    }

    @Test
    void comparesStringsByBytes() throws Exception {
        assertTrue(ops.applyOperator(Operator.LT, TypedValue.ofString("abc"), TypedValue.ofString("abd")));
        assertTrue(ops.applyOperator(Operator.LT, TypedValue.ofString("Z"), TypedValue.ofString("a")));
        assertTrue(ops.applyOperator(Operator.EQ, TypedValue.ofString("bob"), TypedValue.ofString("bob")));
    }

    @Test
    void rejectsUndefinedComparisons() {
        assertThrows(CastException.class,
            () -> ops.applyOperator(Operator.EQ, TypedValue.ofString("1"), TypedValue.ofLong(DataType.UINT32, 1L)));
        assertThrows(CastException.class,
            () -> ops.applyOperator(Operator.GT, TypedValue.ofBool(true), TypedValue.ofBool(false)));
        assertThrows(CastException.class,
            () -> ops.applyOperator(Operator.REG_EQ, TypedValue.ofString("a"), TypedValue.ofString("a")));
    }
}
