package org.regram.compiler.api;

/**
 * Common base of all reportable errors raised by the grammar compiler.
 * <p>
 * Every instance carries a {@link GrammarErrorCode} so callers and tests can branch on the
 * kind of failure without parsing messages.
 */
public abstract class RegramException extends Exception {

    private final GrammarErrorCode code;

    /**
     * Constructs a new exception.
     * @param code The error code.
     * @param message The detail message.
     */
    protected RegramException(GrammarErrorCode code, String message) {
        super(message, null);
        this.code = code;
    }

    /**
     * Constructs a new exception with a cause.
     * @param code The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    protected RegramException(GrammarErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Gets the error code.
     * @return The error code of this failure.
     */
    public GrammarErrorCode getCode() {
        return code;
    }
}
