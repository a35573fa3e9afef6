package work.lcod.cond.xlat;

/**
 * Escapes regex metacharacters in values substituted into a dynamic pattern. Closing square and curly brackets are left alone.
 */
public final class RegexEscape {
    private static final String META = "\\.*+?|^$[{()";

    private RegexEscape() {}

    public static String escape(String value) {
        var out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (META.indexOf(ch) >= 0) {
                out.append('\\');
            }
            out.append(ch);
        }
        return out.toString();
    }
}
