package org.regram.compiler.api;

/**
 * The visibility of a macro.
 */
public enum Visibility {
    /** A composition-only fragment, marked with {@code !} at its definition. */
    INTERNAL,
    /** A consumer-facing pattern. */
    PUBLIC
}
