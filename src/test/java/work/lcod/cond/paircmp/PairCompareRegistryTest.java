package work.lcod.cond.paircmp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.cond.support.CondTestSupport.PREFIX;
import static work.lcod.cond.support.CondTestSupport.SESSION_TIMEOUT;
import static work.lcod.cond.support.CondTestSupport.SUFFIX;
import static work.lcod.cond.support.CondTestSupport.USER_NAME;
import static work.lcod.cond.support.CondTestSupport.dictionary;
import static work.lcod.cond.support.CondTestSupport.request;

import org.junit.jupiter.api.Test;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.request.Pair;
import work.lcod.cond.request.PairList;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.Operator;
import work.lcod.cond.value.StandardValueOps;
import work.lcod.cond.value.TypedValue;

class PairCompareRegistryTest {
    private final PairCompareRegistry registry = PairCompareRegistry.withDefaults(dictionary(), new StandardValueOps());

    @Test
    void prefixAndSuffixLookAtTheUserName() throws Exception {
        var request = request(USER_NAME, "bob@example.org");

        assertEquals(0, registry.compare(request, request.request(), check(PREFIX, "bob", Operator.EQ)));
        assertEquals(1, registry.compare(request, request.request(), check(PREFIX, "alice", Operator.EQ)));
        assertEquals(0, registry.compare(request, request.request(), check(PREFIX, "alice", Operator.NE)));
        assertEquals(0, registry.compare(request, request.request(), check(SUFFIX, "@example.org", Operator.EQ)));
    }

    @Test
    void unsupportedOperatorFails() {
        var request = request(USER_NAME, "bob");

        var thrown = assertThrows(PairCompareException.class,
            () -> registry.compare(request, request.request(), check(SUFFIX, "b", Operator.GT)));
        assertEquals("Suffix does not support operator >", thrown.getMessage());
    }

    @Test
    void withoutUserNameNothingMatches() throws Exception {
        var dictionary = new Dictionary().register(PREFIX);
        var bare = PairCompareRegistry.withDefaults(dictionary, new StandardValueOps());
        var request = request(USER_NAME, "bob");

        assertEquals(1, bare.compare(request, request.request(), check(PREFIX, "bob", Operator.EQ)));
    }

    @Test
    void unregisteredAttributesCompareAgainstRequestInstances() throws Exception {
        var request = request(SESSION_TIMEOUT, 30L, SESSION_TIMEOUT, 60L);
        var check = PairList.singleton(new Pair(SESSION_TIMEOUT, TypedValue.ofLong(DataType.UINT32, 60L), Operator.GE));

        assertEquals(0, registry.compare(request, request.request(), check));
        var missing = PairList.singleton(new Pair(SESSION_TIMEOUT, TypedValue.ofLong(DataType.UINT32, 90L), Operator.GE));
        assertEquals(1, registry.compare(request, request.request(), missing));
    }

    @Test
    void customComparatorsCanBeRegistered() throws Exception {
        var realm = AttributeDef.virtual("Realm", DataType.STRING);
        registry.register(realm, (request, check) -> check.value().stringValue().equals("local") ? 0 : 1);
        var request = request();

        assertTrue(registry.find(realm).isPresent());
        assertEquals(0, registry.compare(request, request.request(),
            PairList.singleton(Pair.of(realm, TypedValue.ofString("local")))));
    }

    private static PairList check(AttributeDef def, String value, Operator op) {
        return PairList.singleton(new Pair(def, TypedValue.ofString(value), op));
    }
}
