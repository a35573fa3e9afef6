package work.lcod.cond.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.request.ListKind;
import work.lcod.cond.request.Request;
import work.lcod.cond.value.CastException;
import work.lcod.cond.value.TypedValue;
import work.lcod.cond.value.ValueOps;

/**
 * Builds requests from JSON documents keyed by list name:
 * {@code {"request": {"User-Name": "bob", "Class": ["a", "b"]}, "control": {...}}}. An optional {@code id}
 * names the request.
 */
public final class RequestLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final Dictionary dictionary;
    private final ValueOps valueOps;

    public RequestLoader(Dictionary dictionary, ValueOps valueOps) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.valueOps = Objects.requireNonNull(valueOps, "valueOps");
    }

    public Request load(Path path) {
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read request: " + path, ex);
        }
    }

    public Request load(InputStream in, String origin) {
        try {
            return fromNode(JSON_MAPPER.readTree(in), origin);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid request document " + origin + ": " + ex.getMessage(), ex);
        }
    }

    public Request parse(String text, String origin) {
        try {
            return fromNode(JSON_MAPPER.readTree(text), origin);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid request document " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private Request fromNode(JsonNode root, String origin) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new Request();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Request document " + origin + " must be an object");
        }
        var request = root.hasNonNull("id") ? new Request(root.get("id").asText()) : new Request();
        var fields = root.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if ("id".equals(entry.getKey())) {
                continue;
            }
            ListKind list;
            try {
                list = ListKind.from(entry.getKey());
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException(origin + ": " + ex.getMessage(), ex);
            }
            fill(request, list, entry.getValue(), origin + ": " + list.label());
        }
        return request;
    }

    private void fill(Request request, ListKind list, JsonNode attributes, String where) {
        if (!attributes.isObject()) {
            throw new IllegalArgumentException(where + " must be an object of attributes");
        }
        var pairs = request.list(list);
        var fields = attributes.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var def = dictionary.find(entry.getKey())
                .orElseThrow(() -> new IllegalArgumentException(where + ": unknown attribute '" + entry.getKey() + "'"));
            if (entry.getValue().isArray()) {
                for (var item : entry.getValue()) {
                    pairs.add(def, value(def, item, where));
                }
            } else {
                pairs.add(def, value(def, entry.getValue(), where));
            }
        }
    }

    private TypedValue value(AttributeDef def, JsonNode node, String where) {
        if (!node.isValueNode() || node.isNull()) {
            throw new IllegalArgumentException(where + "." + def.name() + ": value must be a scalar");
        }
        try {
            var converted = valueOps.cast(TypedValue.ofString(node.asText()), def.type(), def);
            return converted.owned() ? TypedValue.of(converted.type(), converted.payload()) : converted;
        } catch (CastException ex) {
            throw new IllegalArgumentException(where + "." + def.name() + ": " + ex.getMessage(), ex);
        }
    }
}
