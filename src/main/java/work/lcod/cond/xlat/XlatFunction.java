package work.lcod.cond.xlat;

import work.lcod.cond.request.Request;

/**
 * Function callable from a format string as {@code %{name:argument}}. The argument arrives already expanded.
 */
@FunctionalInterface
public interface XlatFunction {
    String apply(Request request, String argument) throws ExpansionException;
}
