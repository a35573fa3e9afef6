package work.lcod.cond.value;

import work.lcod.cond.dict.AttributeDef;

/**
 * Typed-value primitives used by the evaluator: conversion between types and operator application.
 */
public interface ValueOps {
    /**
     * Converts {@code value} to {@code target}. The result is a fresh owned value unless the types already
     * match, in which case {@code value} itself is returned.
     *
     * @param context attribute whose enumerated value names may be used when parsing strings, or null
     */
    TypedValue cast(TypedValue value, DataType target, AttributeDef context) throws CastException;

    /**
     * Applies a non-regex operator to two values of the same type.
     */
    boolean applyOperator(Operator op, TypedValue left, TypedValue right) throws CastException;
}
