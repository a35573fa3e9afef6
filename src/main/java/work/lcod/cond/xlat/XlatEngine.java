package work.lcod.cond.xlat;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.request.ListKind;
import work.lcod.cond.request.Request;
import work.lcod.cond.tree.Template;

/**
 * Expands format strings.
 *
 * <ul>
 *   <li>{@code %%} is a literal percent sign;</li>
 *   <li>{@code %{N}} is regex capture slot N of the request;</li>
 *   <li>{@code %{[list.]Attribute[index]}} is the printed value of an attribute instance, the first one unless
 *   an index ({@code [2]}, {@code [n]} for the last) is given;</li>
 *   <li>{@code %{name:argument}} calls a registered {@link XlatFunction} with the expanded argument.</li>
 * </ul>
 */
public final class XlatEngine {
    private static final Logger LOG = Logger.getLogger(XlatEngine.class.getName());
    private static final Pattern CAPTURE = Pattern.compile("\\d+");
    private static final Pattern FUNCTION = Pattern.compile("([A-Za-z][A-Za-z0-9_-]*):(.*)", Pattern.DOTALL);
    private static final Pattern ATTRIBUTE = Pattern.compile(
        "&?(?:([a-z]+(?:-[a-z]+)*)\\.)?([A-Za-z0-9][A-Za-z0-9_-]*)(?:\\[(\\d+|n)])?");

    private final Dictionary dictionary;
    private final XlatRegistry functions;

    public XlatEngine(Dictionary dictionary, XlatRegistry functions) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    public String expand(Request request, String format, UnaryOperator<String> escape) throws ExpansionException {
        var out = new StringBuilder(format.length());
        int i = 0;
        while (i < format.length()) {
            char ch = format.charAt(i);
            if (ch != '%' || i + 1 >= format.length()) {
                out.append(ch);
                i++;
                continue;
            }
            char marker = format.charAt(i + 1);
            if (marker == '%') {
                out.append('%');
                i += 2;
            } else if (marker == '{') {
                int end = closingBrace(format, i);
                out.append(expression(request, format.substring(i + 2, end), escape));
                i = end + 1;
            } else {
                out.append(ch);
                i++;
            }
        }
        var expanded = out.toString();
        LOG.finer(() -> "xlat \"" + format + "\" -> \"" + expanded + "\"");
        return expanded;
    }

    private String expression(Request request, String expr, UnaryOperator<String> escape) throws ExpansionException {
        if (expr.isBlank()) {
            throw new ExpansionException("Empty %{} expansion");
        }
        String value;
        var function = FUNCTION.matcher(expr);
        if (CAPTURE.matcher(expr).matches()) {
            value = capture(request, expr);
        } else if (function.matches()) {
            var name = function.group(1);
            var fn = functions.find(name)
                .orElseThrow(() -> new ExpansionException("Unknown expansion function: " + name));
            value = fn.apply(request, expand(request, function.group(2), null));
        } else {
            value = attribute(request, expr);
        }
        return escape == null ? value : escape.apply(value);
    }

    private static String capture(Request request, String expr) throws ExpansionException {
        int index;
        try {
            index = Integer.parseInt(expr);
        } catch (NumberFormatException ex) {
            throw new ExpansionException("Invalid capture reference %{" + expr + "}", ex);
        }
        var value = request.captures().get(index);
        return value == null ? "" : value;
    }

    private String attribute(Request request, String expr) throws ExpansionException {
        var matcher = ATTRIBUTE.matcher(expr.trim());
        if (!matcher.matches()) {
            throw new ExpansionException("Invalid attribute reference %{" + expr + "}");
        }
        ListKind list;
        try {
            list = ListKind.from(matcher.group(1));
        } catch (IllegalArgumentException ex) {
            throw new ExpansionException(ex.getMessage(), ex);
        }
        var def = dictionary.find(matcher.group(2))
            .orElseThrow(() -> new ExpansionException("Unknown attribute: " + matcher.group(2)));
        int index = 0;
        if ("n".equals(matcher.group(3))) {
            index = Template.NUM_LAST;
        } else if (matcher.group(3) != null) {
            try {
                index = Integer.parseInt(matcher.group(3));
            } catch (NumberFormatException ex) {
                throw new ExpansionException("Invalid instance index in %{" + expr + "}", ex);
            }
        }
        var pair = request.cursor(Template.attribute(list, def, index)).first();
        return pair == null ? "" : pair.value().print();
    }

    private static int closingBrace(String format, int start) throws ExpansionException {
        int depth = 1;
        int j = start + 2;
        while (j < format.length()) {
            char ch = format.charAt(j);
            if (ch == '%' && j + 1 < format.length() && (format.charAt(j + 1) == '{' || format.charAt(j + 1) == '%')) {
                if (format.charAt(j + 1) == '{') {
                    depth++;
                }
                j += 2;
                continue;
            }
            if (ch == '}' && --depth == 0) {
                return j;
            }
            j++;
        }
        throw new ExpansionException("Unbalanced %{ at offset " + start + " in \"" + format + "\"");
    }
}
