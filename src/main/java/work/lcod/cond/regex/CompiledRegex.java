package work.lcod.cond.regex;

import java.util.Set;

/**
 * Engine-specific compiled pattern. Instances are immutable and may be shared between requests.
 */
public interface CompiledRegex {
    String source();

    Set<RegexFlag> flags();
}
