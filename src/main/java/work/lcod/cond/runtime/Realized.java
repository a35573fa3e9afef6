package work.lcod.cond.runtime;

import work.lcod.cond.value.TypedValue;

/**
 * Outcome of realizing a template: a concrete value, or {@link #DEFERRED} when the template needs iteration.
 */
record Realized(TypedValue value, boolean owned) {
    static final Realized DEFERRED = new Realized(null, false);

    boolean isDeferred() {
        return value == null;
    }
}
