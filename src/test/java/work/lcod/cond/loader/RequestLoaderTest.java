package work.lcod.cond.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.cond.support.CondTestSupport.REPLY_MESSAGE;
import static work.lcod.cond.support.CondTestSupport.SERVICE_TYPE;
import static work.lcod.cond.support.CondTestSupport.SESSION_TIMEOUT;
import static work.lcod.cond.support.CondTestSupport.dictionary;
import static work.lcod.cond.support.CondTestSupport.fixture;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import work.lcod.cond.request.ListKind;
import work.lcod.cond.value.StandardValueOps;

class RequestLoaderTest {
    private final RequestLoader loader = new RequestLoader(dictionary(), new StandardValueOps());

    @Test
    void loadsListsAndTypedValues() {
        var request = loader.load(fixture("framed-user.json"));

        assertEquals("req-42", request.id());
        assertEquals(2L, request.request().find(SERVICE_TYPE).get(0).value().longValue());
        var timeouts = request.request().find(SESSION_TIMEOUT);
        assertEquals(2, timeouts.size());
        assertEquals(60L, timeouts.get(1).value().longValue());
        assertEquals("welcome", request.list(ListKind.REPLY).find(REPLY_MESSAGE).get(0).value().stringValue());
        assertTrue(request.request().stream().noneMatch(pair -> pair.value().owned()));
    }

    @Test
    void readsFromStreams() {
        var json = "{\"request\": {\"User-Name\": \"bob\"}}";

        var request = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "stdin");

        assertEquals(1, request.request().size());
    }

    @Test
    void rejectsUnknownNamesAndBadValues() {
        var attribute = assertThrows(IllegalArgumentException.class,
            () -> loader.parse("{\"request\": {\"Nope\": 1}}", "inline"));
        assertEquals("inline: request: unknown attribute 'Nope'", attribute.getMessage());

        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"outer\": {}}", "inline"));
        assertThrows(IllegalArgumentException.class,
            () -> loader.parse("{\"request\": {\"Session-Timeout\": \"soon\"}}", "inline"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("[1, 2]", "inline"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"request\": ", "inline"));
    }
}
