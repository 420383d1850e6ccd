package org.regram.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while compiling a grammar
 * or adapting one of its macros to a regex dialect.
 * This decouples test logic from the wording of error messages.
 */
public enum GrammarErrorCode {
    // region Grammar text errors
    /** A line does not have the shape of a macro definition, or a block comment is not terminated. */
    MALFORMED_DEFINITION,
    /** A macro name does not satisfy identifier syntax. */
    INVALID_IDENTIFIER,
    /** A macro name was defined a second time. */
    DUPLICATE_NAME,
    /** A body references a macro that is not defined before it. */
    UNDEFINED_REFERENCE,
    /** A configured ceiling on macro count, body size or expansion size was exceeded. */
    RESOURCE_LIMIT_EXCEEDED,
    // endregion

    // region Dialect errors
    /** The expanded pattern contains a construct the target dialect cannot express. */
    UNSUPPORTED_CONSTRUCT,
    /** The same capture group name occurs more than once and the dialect forbids it. */
    DUPLICATE_GROUP_NAME,
    /** The requested macro does not exist in the compiled grammar. */
    UNKNOWN_MACRO,
    // endregion

    // region General errors
    /** An I/O error occurred while reading a grammar file. */
    IO_ERROR_READING_FILE
    // endregion
}
