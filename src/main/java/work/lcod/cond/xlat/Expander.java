package work.lcod.cond.xlat;

import java.util.function.UnaryOperator;
import work.lcod.cond.request.Request;
import work.lcod.cond.tree.Template;

/**
 * Turns {@code EXEC}, {@code XLAT} and {@code REGEX_XLAT} templates into strings for a request.
 */
@FunctionalInterface
public interface Expander {
    /**
     * @param escape applied to every substituted value, or null to insert values as they are
     */
    String expand(Request request, Template template, UnaryOperator<String> escape) throws ExpansionException;
}
