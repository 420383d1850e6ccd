package org.regram.compiler.api;

/**
 * An exception thrown when a compiled macro cannot be adapted to a requested dialect.
 * <p>
 * Dialect errors are scoped to a single (macro, profile) request. The compiled grammar
 * stays valid and other requests are unaffected.
 */
public class DialectException extends RegramException {

    private final String macroName;

    public DialectException(GrammarErrorCode code, String macroName, String message) {
        super(code, macroName != null ? String.format("Macro '%s': %s", macroName, message) : message);
        this.macroName = macroName;
    }

    /**
     * Gets the name of the macro whose adaptation failed.
     * @return The macro name, or null if the failure is not tied to a macro.
     */
    public String getMacroName() {
        return macroName;
    }
}
