package org.regram.compiler.api;

/**
 * An exception thrown when a grammar text cannot be compiled.
 * <p>
 * It is part of the public API and hides the internal types of the compiler. Compilation stops
 * at the first such error; no partially compiled grammar is ever returned.
 */
public class GrammarException extends RegramException {

    private final SourceInfo sourceInfo;
    private final String macroName;

    /**
     * Constructs a new grammar exception.
     * @param code The error code.
     * @param message The detail message, without location.
     * @param sourceInfo The location of the offending line, or null if unknown.
     * @param macroName The macro being processed, or null if not applicable.
     */
    public GrammarException(GrammarErrorCode code, String message, SourceInfo sourceInfo, String macroName) {
        super(code, sourceInfo != null ? String.format("%s: %s", sourceInfo, message) : message);
        this.sourceInfo = sourceInfo;
        this.macroName = macroName;
    }

    /**
     * Constructs a new grammar exception with a cause.
     * @param code The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public GrammarException(GrammarErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
        this.sourceInfo = null;
        this.macroName = null;
    }

    /**
     * Gets the location of the error.
     * @return The source location, or null if the error is not tied to a line.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * Gets the 1-based line number of the error.
     * @return The line number, or 0 if unknown.
     */
    public int getLineNumber() {
        return sourceInfo != null ? sourceInfo.lineNumber() : 0;
    }

    /**
     * Gets the name of the macro being processed when the error occurred.
     * @return The macro name, or null.
     */
    public String getMacroName() {
        return macroName;
    }
}
