package work.lcod.cond.api;

/**
 * Failure categories reported by the evaluator.
 */
public enum ErrorKind {
    EXPANSION_FAILURE,
    CAST_FAILURE,
    REGEX_COMPILE_FAILURE,
    REGEX_EXEC_FAILURE,
    LEGACY_COMPARATOR_FAILURE,
    UNDEFINED_OPERATOR,
    /** An unresolved template or unsupported node reached evaluation; the tree builder is broken. */
    STRUCTURAL_VIOLATION
}
