package work.lcod.cond.regex;

import java.util.EnumSet;
import java.util.Set;

/**
 * Regex modifiers written after the closing slash of a pattern ({@code /foo/i}).
 */
public enum RegexFlag {
    IGNORE_CASE('i'),
    MULTILINE('m'),
    DOT_ALL('s'),
    EXTENDED('x'),
    UNICODE('u');

    private final char letter;

    RegexFlag(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    public static Set<RegexFlag> parse(String letters) {
        var flags = EnumSet.noneOf(RegexFlag.class);
        if (letters == null) {
            return flags;
        }
        for (char ch : letters.toCharArray()) {
            flags.add(fromLetter(ch));
        }
        return flags;
    }

    public static RegexFlag fromLetter(char ch) {
        for (var flag : values()) {
            if (flag.letter == ch) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Unsupported regex flag: " + ch);
    }

    public static String letters(Set<RegexFlag> flags) {
        var builder = new StringBuilder();
        for (var flag : values()) {
            if (flags.contains(flag)) {
                builder.append(flag.letter);
            }
        }
        return builder.toString();
    }
}
