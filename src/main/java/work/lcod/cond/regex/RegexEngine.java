package work.lcod.cond.regex;

import java.util.Set;

/**
 * Regular expression backend used for {@code =~} comparisons.
 */
public interface RegexEngine {
    CompiledRegex compile(String pattern, Set<RegexFlag> flags) throws RegexException;

    /**
     * Number of capture slots the pattern fills, including slot 0, or 0 when the pattern declares no groups.
     */
    int subcaptureCount(CompiledRegex regex);

    /**
     * Searches {@code subject} for the pattern.
     *
     * @return the captured groups, or null when the subject does not match
     */
    RegexMatch exec(CompiledRegex regex, String subject) throws RegexException;
}
