package org.regram.compiler.diagnostics;

/**
 * Represents a single non-fatal diagnostic message produced while compiling a grammar.
 *
 * @param type       The type of the diagnostic.
 * @param message    The diagnostic message.
 * @param sourceName The name of the grammar where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param macroName  The macro the issue belongs to, or null.
 */
public record Diagnostic(
        Type type,
        String message,
        String sourceName,
        int lineNumber,
        String macroName
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A questionable construct that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, sourceName, lineNumber, message);
    }
}
