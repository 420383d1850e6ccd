package org.regram.compiler.frontend.parser;

import org.regram.compiler.api.Visibility;

/**
 * A single macro definition as written in the grammar.
 *
 * @param id         The 0-based definition ordinal; also the index of the macro in every per-macro array.
 * @param name       The macro name.
 * @param visibility Whether the macro is internal or public.
 * @param rawBody    The body text, still containing reference tokens.
 * @param sourceLine The 1-based line of the definition.
 */
public record MacroDefinition(
        int id,
        String name,
        Visibility visibility,
        String rawBody,
        int sourceLine
) {
}
