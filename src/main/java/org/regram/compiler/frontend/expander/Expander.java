package org.regram.compiler.frontend.expander;

import org.regram.compiler.CompilerLimits;
import org.regram.compiler.api.CompiledMacro;
import org.regram.compiler.api.InternalExpansionInvariantError;
import org.regram.compiler.api.ResourceLimitExceededException;
import org.regram.compiler.api.SourceInfo;
import org.regram.compiler.frontend.dependency.DependencyGraph;
import org.regram.compiler.frontend.dependency.MacroBody;
import org.regram.compiler.frontend.dependency.ReferenceScanner;
import org.regram.compiler.frontend.dependency.ReferenceToken;
import org.regram.compiler.frontend.parser.MacroDefinition;
import org.regram.compiler.frontend.parser.MacroTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fourth phase: substitutes every reference with the expansion of the referenced macro.
 * <p>
 * Macros are expanded strictly in definition order, which the resolver guarantees to be topological.
 * Each expansion is computed once into an arena slot indexed by macro id and reused verbatim by every
 * later reference, so deep reuse chains never re-expand a macro. Substitution adds no grouping of its
 * own; parenthesization is exactly as authored.
 */
public class Expander {

    private static final Logger log = LoggerFactory.getLogger(Expander.class);

    private final String sourceName;
    private final CompilerLimits limits;

    public Expander(String sourceName, CompilerLimits limits) {
        this.sourceName = sourceName;
        this.limits = limits;
    }

    /**
     * Expands all macros.
     *
     * @param table The macro table.
     * @param graph The resolved dependency graph of the same table.
     * @return One compiled macro per definition, indexed by id.
     * @throws ResourceLimitExceededException if an expansion would exceed the configured maximum length.
     */
    public List<CompiledMacro> expand(MacroTable table, DependencyGraph graph) throws ResourceLimitExceededException {
        String[] arena = new String[table.size()];
        List<CompiledMacro> compiled = new ArrayList<>(table.size());
        int longest = 0;

        for (MacroBody body : graph.bodies()) {
            MacroDefinition definition = table.byId(body.macroId());

            long length = 0;
            for (MacroBody.Segment segment : body.segments()) {
                if (segment.isReference()) {
                    String memo = arena[segment.referenceId()];
                    if (memo == null) {
                        throw new InternalExpansionInvariantError("Reference '" + segment.text() + "' in macro '"
                                + definition.name() + "' has no expansion yet");
                    }
                    length += memo.length();
                } else {
                    checkNoReference(definition, segment);
                    length += segment.text().length();
                }
            }
            if (length > limits.maxExpandedLength()) {
                throw new ResourceLimitExceededException("max-expanded-length", limits.maxExpandedLength(), length,
                        new SourceInfo(sourceName, definition.sourceLine()), definition.name());
            }

            StringBuilder expansion = new StringBuilder((int) length);
            for (MacroBody.Segment segment : body.segments()) {
                expansion.append(segment.isReference() ? arena[segment.referenceId()] : segment.text());
            }
            arena[body.macroId()] = expansion.toString();
            longest = Math.max(longest, expansion.length());

            compiled.add(new CompiledMacro(definition.name(), definition.visibility(), definition.sourceLine(),
                    arena[body.macroId()]));
        }

        log.debug("Expanded {} macros of '{}', longest expansion {} characters", compiled.size(), sourceName, longest);
        return compiled;
    }

    /**
     * Literal text between substitutions must not contain a reference of its own. The joined expansion is
     * not rescanned: a {@code $} ending one piece and a {@code (name)} starting the next is regex text.
     */
    private static void checkNoReference(MacroDefinition definition, MacroBody.Segment literal) {
        List<ReferenceToken> residual = ReferenceScanner.scan(literal.text());
        if (!residual.isEmpty()) {
            throw new InternalExpansionInvariantError("Macro '" + definition.name() + "' still references '"
                    + residual.get(0).name() + "' in literal text '" + literal.text() + "'");
        }
    }
}
