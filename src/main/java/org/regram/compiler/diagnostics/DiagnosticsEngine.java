package org.regram.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the non-fatal diagnostics of one compilation.
 * <p>
 * Errors are not collected here: the compiler fails fast and raises them as exceptions. This engine
 * keeps lint findings so they can be handed to the caller together with the compiled grammar.
 * Not thread-safe; one instance belongs to one compilation.
 */
public class DiagnosticsEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a warning and logs it.
     *
     * @param message    The warning message.
     * @param sourceName The grammar in which the warning occurred.
     * @param lineNumber The line number of the warning.
     * @param macroName  The macro concerned, or null.
     */
    public void reportWarning(String message, String sourceName, int lineNumber, String macroName) {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.WARNING, message, sourceName, lineNumber, macroName);
        diagnostics.add(diagnostic);
        log.warn("{}:{}: {}", sourceName, lineNumber, message);
    }

    /**
     * Returns only the warnings, as an immutable snapshot.
     *
     * @return The warnings in the order they were reported.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.WARNING)
                .toList();
    }
}
