package org.regram.compiler.api;

/**
 * Signals a broken internal invariant of the compiler, for example a reference that survived
 * expansion or an unbalanced adapted pattern. This is a logic fault, never an input error,
 * and is not meant to be caught.
 */
public class InternalExpansionInvariantError extends IllegalStateException {

    public InternalExpansionInvariantError(String message) {
        super(message);
    }
}
