package work.lcod.cond.tree;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.regex.CompiledRegex;
import work.lcod.cond.regex.RegexFlag;
import work.lcod.cond.request.ListKind;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.TypedValue;

/**
 * Reference to a value source used as a condition operand, with an optional explicit cast.
 *
 * <p>Only the fields relevant to {@link #kind()} are populated; the others are null.
 */
public final class Template {
    /** Instance selector matching every instance of an attribute. */
    public static final int NUM_ANY = -1;
    /** Instance selector matching the last instance of an attribute. */
    public static final int NUM_LAST = -2;

    private final TemplateKind kind;
    private final String source;
    private final ListKind list;
    private final AttributeDef attribute;
    private final int index;
    private final CompiledRegex regex;
    private final Set<RegexFlag> regexFlags;
    private final TypedValue data;
    private final DataType cast;

    private Template(
        TemplateKind kind,
        String source,
        ListKind list,
        AttributeDef attribute,
        int index,
        CompiledRegex regex,
        Set<RegexFlag> regexFlags,
        TypedValue data,
        DataType cast
    ) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.source = source;
        this.list = list;
        this.attribute = attribute;
        this.index = index;
        this.regex = regex;
        this.regexFlags = regexFlags == null || regexFlags.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(regexFlags));
        this.data = data;
        this.cast = cast;
    }

    public static Template attribute(AttributeDef def) {
        return attribute(ListKind.REQUEST, def, NUM_ANY);
    }

    public static Template attribute(ListKind list, AttributeDef def) {
        return attribute(list, def, NUM_ANY);
    }

    public static Template attribute(ListKind list, AttributeDef def, int index) {
        Objects.requireNonNull(list, "list");
        Objects.requireNonNull(def, "def");
        if (index < NUM_LAST) {
            throw new IllegalArgumentException("Invalid instance index " + index + " for " + def.name());
        }
        return new Template(TemplateKind.ATTRIBUTE, def.name(), list, def, index, null, null, null, null);
    }

    public static Template list(ListKind list) {
        Objects.requireNonNull(list, "list");
        return new Template(TemplateKind.LIST, list.label(), list, null, NUM_ANY, null, null, null, null);
    }

    public static Template exec(String command) {
        return new Template(TemplateKind.EXEC, requireText(command, "command"), null, null, NUM_ANY, null, null, null, null);
    }

    public static Template xlat(String format) {
        return new Template(TemplateKind.XLAT, requireText(format, "format"), null, null, NUM_ANY, null, null, null, null);
    }

    public static Template regex(CompiledRegex regex) {
        Objects.requireNonNull(regex, "regex");
        return new Template(TemplateKind.REGEX, regex.source(), null, null, NUM_ANY, regex, regex.flags(), null, null);
    }

    public static Template regexXlat(String format, Set<RegexFlag> flags) {
        return new Template(TemplateKind.REGEX_XLAT, requireText(format, "format"), null, null, NUM_ANY, null, flags, null, null);
    }

    public static Template data(TypedValue value) {
        Objects.requireNonNull(value, "value");
        if (value.owned()) {
            throw new IllegalArgumentException("Literal values must not be owned by the evaluator");
        }
        return new Template(TemplateKind.DATA, null, null, null, NUM_ANY, null, null, value, null);
    }

    public static Template unresolved(String text) {
        return new Template(TemplateKind.UNRESOLVED, requireText(text, "text"), null, null, NUM_ANY, null, null, null, null);
    }

    /**
     * Returns a copy carrying an explicit cast, or without one when {@code type} is null.
     */
    public Template withCast(DataType type) {
        return new Template(kind, source, list, attribute, index, regex, regexFlags, data, type);
    }

    public TemplateKind kind() {
        return kind;
    }

    /**
     * Attribute name, list name, expansion format, command line, regex source or unresolved text.
     */
    public String source() {
        return source;
    }

    public ListKind list() {
        return list;
    }

    public AttributeDef attribute() {
        return attribute;
    }

    public int index() {
        return index;
    }

    public CompiledRegex regex() {
        return regex;
    }

    public Set<RegexFlag> regexFlags() {
        return regexFlags;
    }

    public TypedValue data() {
        return data;
    }

    public DataType cast() {
        return cast;
    }

    public boolean hasCast() {
        return cast != null;
    }

    public boolean isAttribute() {
        return kind == TemplateKind.ATTRIBUTE;
    }

    public boolean isData() {
        return kind == TemplateKind.DATA;
    }

    /**
     * Type the template evaluates to when it is known without looking at a request.
     */
    public DataType declaredType() {
        if (cast != null) {
            return cast;
        }
        return switch (kind) {
            case ATTRIBUTE -> attribute.type();
            case DATA -> data.type();
            case LIST, EXEC, XLAT, REGEX, REGEX_XLAT, UNRESOLVED -> null;
        };
    }

    @Override
    public String toString() {
        var prefix = cast == null ? "" : "<" + cast.label() + ">";
        return prefix + switch (kind) {
            case ATTRIBUTE -> "&" + (list == ListKind.REQUEST ? "" : list.label() + ".") + source + indexSuffix();
            case LIST -> "&" + source + ":";
            case EXEC -> "`" + source + "`";
            case XLAT -> "\"" + source + "\"";
            case REGEX -> "/" + source + "/" + RegexFlag.letters(regexFlags);
            case REGEX_XLAT -> "/" + source + "/" + RegexFlag.letters(regexFlags);
            case DATA -> data.type() == DataType.STRING ? "\"" + data.stringValue() + "\"" : data.print();
            case UNRESOLVED -> source;
        };
    }

    private String indexSuffix() {
        return switch (index) {
            case NUM_ANY -> "";
            case NUM_LAST -> "[n]";
            default -> "[" + index + "]";
        };
    }

    private static String requireText(String value, String label) {
        if (value == null) {
            throw new IllegalArgumentException("Template " + label + " is required");
        }
        return value;
    }
}
