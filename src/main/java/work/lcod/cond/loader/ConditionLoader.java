package work.lcod.cond.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import work.lcod.cond.api.ResultCode;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.regex.RegexEngine;
import work.lcod.cond.regex.RegexException;
import work.lcod.cond.regex.RegexFlag;
import work.lcod.cond.request.ListKind;
import work.lcod.cond.tree.ConditionNode;
import work.lcod.cond.tree.Conditions;
import work.lcod.cond.tree.Fixup;
import work.lcod.cond.tree.Template;
import work.lcod.cond.value.CastException;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.Operator;
import work.lcod.cond.value.TypedValue;
import work.lcod.cond.value.ValueOps;

/**
 * Builds condition trees from YAML or JSON documents.
 *
 * <pre>
 * condition:
 *   - map: { lhs: { attr: User-Name }, op: "==", rhs: { data: bob } }
 *   - and
 *   - negate: true
 *     group:
 *       - map: { lhs: "&amp;Service-Type", op: "==", rhs: Framed-User }
 *       - or
 *       - rcode: ok
 * </pre>
 *
 * <p>Names are resolved against the dictionary, literals are converted to their final type and patterns are
 * compiled while loading, so the resulting tree holds no unresolved templates.
 */
public final class ConditionLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Dictionary dictionary;
    private final RegexEngine regexEngine;
    private final ValueOps valueOps;

    public ConditionLoader(Dictionary dictionary, RegexEngine regexEngine, ValueOps valueOps) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.regexEngine = Objects.requireNonNull(regexEngine, "regexEngine");
        this.valueOps = Objects.requireNonNull(valueOps, "valueOps");
    }

    public ConditionNode load(Path path) {
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read condition: " + path, ex);
        }
    }

    public ConditionNode parse(String text, String origin) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid condition document " + origin + ": " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.hasNonNull("condition")) {
            throw new IllegalArgumentException("Condition document " + origin + " has no 'condition' entry");
        }
        return chain(root.get("condition"), origin + ": condition");
    }

    private ConditionNode chain(JsonNode entries, String where) {
        if (!entries.isArray() || entries.isEmpty()) {
            throw new IllegalArgumentException(where + " must be a non-empty list");
        }
        var nodes = new ArrayList<ConditionNode>();
        int index = 0;
        for (var entry : entries) {
            nodes.add(entry(entry, where + "[" + index++ + "]"));
        }
        try {
            return Conditions.chain(nodes);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
    }

    private ConditionNode entry(JsonNode entry, String where) {
        if (entry.isTextual() || entry.isBoolean()) {
            return switch (entry.asText().trim().toLowerCase(Locale.ROOT)) {
                case "and", "&&" -> Conditions.and();
                case "or", "||" -> Conditions.or();
                case "true" -> Conditions.alwaysTrue();
                case "false" -> Conditions.alwaysFalse();
                default -> throw new IllegalArgumentException(where + ": unknown entry '" + entry.asText() + "'");
            };
        }
        if (!entry.isObject()) {
            throw new IllegalArgumentException(where + " must be a string or an object");
        }
        ConditionNode node;
        if (entry.has("map")) {
            node = map(entry.get("map"), where + ".map");
        } else if (entry.has("template")) {
            node = Conditions.template(template(entry.get("template"), null, where + ".template"));
        } else if (entry.has("rcode")) {
            node = Conditions.rcode(rcode(entry.get("rcode"), where));
        } else if (entry.has("group")) {
            node = Conditions.group(chain(entry.get("group"), where + ".group"));
        } else {
            throw new IllegalArgumentException(where + ": expected one of map, template, rcode or group");
        }
        var negate = entry.get("negate");
        if (negate != null && negate.asBoolean(false)) {
            Conditions.not(node);
        }
        return node;
    }

    private static ResultCode rcode(JsonNode value, String where) {
        try {
            return ResultCode.from(value.asText());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
    }

    private ConditionNode map(JsonNode spec, String where) {
        if (!spec.isObject() || !spec.hasNonNull("lhs") || !spec.hasNonNull("op") || !spec.hasNonNull("rhs")) {
            throw new IllegalArgumentException(where + " needs lhs, op and rhs");
        }
        var token = spec.get("op").asText().trim();
        boolean negate = false;
        if ("!~".equals(token)) {
            token = Operator.REG_EQ.token();
            negate = true;
        }
        Operator op;
        try {
            op = Operator.fromToken(token);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
        var lhsSpec = spec.get("lhs");
        var rhsSpec = spec.get("rhs");
        var lhs = template(lhsSpec, null, where + ".lhs");
        var rhs = template(rhsSpec, op == Operator.REG_EQ ? null : lhs, where + ".rhs");
        if (lhs.isData() && !hasExplicitType(lhsSpec) && rhs.isAttribute() && op != Operator.REG_EQ) {
            lhs = template(lhsSpec, rhs, where + ".lhs");
        }
        if (op == Operator.REG_EQ && !isRegexOperand(rhs)) {
            throw new IllegalArgumentException(where + ": =~ needs a regex or an expansion on the right");
        }
        Fixup fixup = Fixup.NONE;
        if (lhs.isAttribute() && lhs.attribute().virtual()) {
            fixup = Fixup.PAIR_COMPARE;
        } else if ((lhs.isAttribute() && rhs.isData()) || (rhs.isAttribute() && lhs.isData())) {
            fixup = Fixup.TYPE;
        }
        var node = Conditions.map(lhs, op, rhs, fixup);
        return negate ? Conditions.not(node) : node;
    }

    private static boolean isRegexOperand(Template template) {
        return switch (template.kind()) {
            case REGEX, REGEX_XLAT, XLAT, EXEC, DATA -> true;
            case ATTRIBUTE, LIST, UNRESOLVED -> false;
        };
    }

    private static boolean hasExplicitType(JsonNode spec) {
        return spec.isObject() && (spec.has("type") || spec.has("cast"));
    }

    /**
     * @param sibling the other operand, used to type untyped literals; null when literals stay strings
     */
    private Template template(JsonNode spec, Template sibling, String where) {
        if (!spec.isObject()) {
            return shorthand(spec, sibling, where);
        }
        var cast = type(spec.get("cast"), where);
        Template template;
        if (spec.has("attr")) {
            template = attribute(spec, where);
        } else if (spec.has("list")) {
            template = Template.list(list(spec.get("list").asText(), where));
        } else if (spec.has("data")) {
            var declared = type(spec.get("type"), where);
            var literal = literal(spec.get("data"), cast != null ? cast : declared, sibling, where);
            return cast == null ? literal : literal.withCast(cast);
        } else if (spec.has("xlat")) {
            template = Template.xlat(spec.get("xlat").asText());
        } else if (spec.has("exec")) {
            template = Template.exec(spec.get("exec").asText());
        } else if (spec.has("regex")) {
            template = regex(spec.get("regex").asText(), flags(spec, where), where);
        } else if (spec.has("regex_xlat")) {
            template = Template.regexXlat(spec.get("regex_xlat").asText(), flags(spec, where));
        } else {
            throw new IllegalArgumentException(where + ": expected one of attr, list, data, xlat, exec, regex or regex_xlat");
        }
        return cast == null ? template : template.withCast(cast);
    }

    private Template shorthand(JsonNode spec, Template sibling, String where) {
        if (spec.isTextual() && spec.asText().startsWith("&")) {
            var text = spec.asText().substring(1);
            var dot = text.indexOf('.');
            if (dot > 0 && isListName(text.substring(0, dot))) {
                return Template.attribute(list(text.substring(0, dot), where), resolve(text.substring(dot + 1), where));
            }
            return Template.attribute(resolve(text, where));
        }
        if (spec.isValueNode()) {
            return literal(spec, null, sibling, where);
        }
        throw new IllegalArgumentException(where + " must be a template object or a scalar");
    }

    private Template attribute(JsonNode spec, String where) {
        var def = resolve(spec.get("attr").asText(), where);
        var list = spec.has("list") ? list(spec.get("list").asText(), where) : ListKind.REQUEST;
        int index = Template.NUM_ANY;
        var indexNode = spec.get("index");
        if (indexNode != null) {
            if (indexNode.isInt()) {
                index = indexNode.asInt();
            } else if ("n".equals(indexNode.asText())) {
                index = Template.NUM_LAST;
            } else if (!"*".equals(indexNode.asText())) {
                throw new IllegalArgumentException(where + ": invalid index " + indexNode);
            }
        }
        try {
            return Template.attribute(list, def, index);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
    }

    private Template literal(JsonNode value, DataType declared, Template sibling, String where) {
        if (!value.isValueNode() || value.isNull()) {
            throw new IllegalArgumentException(where + ": literal must be a scalar");
        }
        AttributeDef context = sibling != null && sibling.isAttribute() ? sibling.attribute() : null;
        var type = declared;
        if (type == null && sibling != null) {
            type = sibling.declaredType();
        }
        if (type == null) {
            type = DataType.STRING;
        }
        var text = TypedValue.ofString(value.asText());
        try {
            var converted = valueOps.cast(text, type, context);
            return Template.data(converted.owned() ? TypedValue.of(converted.type(), converted.payload()) : converted);
        } catch (CastException ex) {
            throw new IllegalArgumentException(where + ": cannot use '" + value.asText() + "' as " + type.label() + ": " + ex.getMessage(), ex);
        }
    }

    private Template regex(String pattern, Set<RegexFlag> flags, String where) {
        try {
            return Template.regex(regexEngine.compile(pattern, flags));
        } catch (RegexException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
    }

    private static Set<RegexFlag> flags(JsonNode spec, String where) {
        try {
            return RegexFlag.parse(spec.has("flags") ? spec.get("flags").asText() : null);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
    }

    private static DataType type(JsonNode value, String where) {
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return DataType.fromName(value.asText());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
    }

    private AttributeDef resolve(String name, String where) {
        return dictionary.find(name)
            .orElseThrow(() -> new IllegalArgumentException(where + ": unknown attribute '" + name + "'"));
    }

    private static ListKind list(String name, String where) {
        try {
            return ListKind.from(name);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
    }

    private static boolean isListName(String name) {
        return List.of(ListKind.values()).stream().anyMatch(kind -> kind.label().equalsIgnoreCase(name));
    }
}
