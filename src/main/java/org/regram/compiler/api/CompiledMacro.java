package org.regram.compiler.api;

/**
 * A macro whose body has every reference fully substituted. Dialect-agnostic and immutable.
 *
 * @param name         The macro name.
 * @param visibility   The visibility declared at the definition.
 * @param sourceLine   The line of the definition.
 * @param expandedBody The body with all references replaced by their expansions.
 */
public record CompiledMacro(
        String name,
        Visibility visibility,
        int sourceLine,
        String expandedBody
) {
}
