package work.lcod.cond.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@link RegexEngine} backed by {@link java.util.regex.Pattern}. Matching is a search, not an anchored match.
 */
public final class JdkRegexEngine implements RegexEngine {
    @Override
    public CompiledRegex compile(String pattern, Set<RegexFlag> flags) throws RegexException {
        var normalized = flags == null || flags.isEmpty() ? EnumSet.noneOf(RegexFlag.class) : EnumSet.copyOf(flags);
        try {
            return new JdkRegex(Pattern.compile(pattern, toPatternFlags(normalized)), normalized);
        } catch (PatternSyntaxException ex) {
            throw new RegexException("Invalid regex /" + pattern + "/: " + ex.getDescription(), ex.getIndex(), ex);
        }
    }

    @Override
    public int subcaptureCount(CompiledRegex regex) {
        int groups = unwrap(regex).pattern.matcher("").groupCount();
        return groups == 0 ? 0 : groups + 1;
    }

    @Override
    public RegexMatch exec(CompiledRegex regex, String subject) throws RegexException {
        var matcher = unwrap(regex).pattern.matcher(subject);
        try {
            if (!matcher.find()) {
                return null;
            }
        } catch (StackOverflowError err) {
            throw new RegexException("Regex /" + regex.source() + "/ exhausted the stack while matching", -1, err);
        }
        var groups = new ArrayList<String>(matcher.groupCount() + 1);
        for (int i = 0; i <= matcher.groupCount(); i++) {
            groups.add(matcher.group(i));
        }
        return new RegexMatch(groups);
    }

    private static JdkRegex unwrap(CompiledRegex regex) {
        if (regex instanceof JdkRegex jdk) {
            return jdk;
        }
        throw new IllegalArgumentException("Regex was not compiled by " + JdkRegexEngine.class.getSimpleName());
    }

    private static int toPatternFlags(Set<RegexFlag> flags) {
        int bits = 0;
        for (var flag : flags) {
            bits |= switch (flag) {
                case IGNORE_CASE -> Pattern.CASE_INSENSITIVE;
                case MULTILINE -> Pattern.MULTILINE;
                case DOT_ALL -> Pattern.DOTALL;
                case EXTENDED -> Pattern.COMMENTS;
                case UNICODE -> Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
            };
        }
        return bits;
    }

    private static final class JdkRegex implements CompiledRegex {
        private final Pattern pattern;
        private final Set<RegexFlag> flags;

        private JdkRegex(Pattern pattern, Set<RegexFlag> flags) {
            this.pattern = pattern;
            this.flags = Collections.unmodifiableSet(flags);
        }

        @Override
        public String source() {
            return pattern.pattern();
        }

        @Override
        public Set<RegexFlag> flags() {
            return flags;
        }

        @Override
        public String toString() {
            return "/" + pattern.pattern() + "/" + RegexFlag.letters(flags);
        }
    }
}
