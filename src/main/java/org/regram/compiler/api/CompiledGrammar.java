package org.regram.compiler.api;

import org.regram.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * The immutable result of compiling a grammar: every macro expanded, ready to be adapted to a dialect.
 * <p>
 * Implementations are safe for concurrent use. Adapted patterns are cached per
 * (macro, profile, options) key for the lifetime of the grammar.
 */
public interface CompiledGrammar {

    /**
     * Adapts a macro to a dialect with default options.
     *
     * @param name    The macro name.
     * @param profile The capabilities of the target engine.
     * @return The final pattern.
     * @throws DialectException if the macro is unknown or cannot be expressed in the dialect.
     */
    default CompiledPattern pattern(String name, DialectProfile profile) throws DialectException {
        return pattern(name, profile, AdaptOptions.DEFAULTS);
    }

    /**
     * Adapts a macro to a dialect.
     *
     * @param name    The macro name.
     * @param profile The capabilities of the target engine.
     * @param options Caller intent for rewrites that the profile leaves open.
     * @return The final pattern.
     * @throws DialectException if the macro is unknown or cannot be expressed in the dialect.
     */
    CompiledPattern pattern(String name, DialectProfile profile, AdaptOptions options) throws DialectException;

    /**
     * Looks up the dialect-agnostic expansion of a macro.
     * @param name The macro name.
     * @return The compiled macro, or empty if no macro has this name.
     */
    Optional<CompiledMacro> macro(String name);

    /**
     * Gets all macro names in definition order.
     * @return The macro names.
     */
    List<String> macroNames();

    /**
     * Gets the names of public macros in definition order.
     * @return The public macro names.
     */
    List<String> publicMacroNames();

    /**
     * Gets the macros directly referenced by a macro, in order of first reference.
     * @param name The macro name.
     * @return The referenced macro names; empty if the macro references nothing or does not exist.
     */
    List<String> dependenciesOf(String name);

    /**
     * Gets the macros that reference a macro directly.
     * @param name The macro name.
     * @return The referencing macro names in definition order.
     */
    List<String> dependentsOf(String name);

    /**
     * Gets the non-fatal diagnostics produced while compiling, such as lint warnings.
     * @return The warnings.
     */
    List<Diagnostic> warnings();
}
