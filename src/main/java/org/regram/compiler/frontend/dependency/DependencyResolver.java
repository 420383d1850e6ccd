package org.regram.compiler.frontend.dependency;

import org.regram.compiler.api.InternalExpansionInvariantError;
import org.regram.compiler.api.SourceInfo;
import org.regram.compiler.api.UndefinedReferenceException;
import org.regram.compiler.diagnostics.DiagnosticsEngine;
import org.regram.compiler.frontend.parser.MacroDefinition;
import org.regram.compiler.frontend.parser.MacroTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Third phase: resolves every reference token against the definitions that precede it and builds the
 * {@link DependencyGraph}.
 * <p>
 * A reference may only name a macro defined on an earlier line. This single rule rejects self
 * references and forward references alike, so the graph is acyclic by construction and no
 * separate cycle search is needed.
 */
public class DependencyResolver {

    private final String sourceName;
    private final DiagnosticsEngine diagnostics;

    public DependencyResolver(String sourceName, DiagnosticsEngine diagnostics) {
        this.sourceName = sourceName;
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves all bodies of the table.
     *
     * @param table The parsed macro table.
     * @return The dependency graph.
     * @throws UndefinedReferenceException for the first reference to a name not defined earlier.
     */
    public DependencyGraph resolve(MacroTable table) throws UndefinedReferenceException {
        List<MacroBody> bodies = new ArrayList<>(table.size());
        List<DependencyEdge> edges = new ArrayList<>();

        for (MacroDefinition definition : table.definitions()) {
            String raw = definition.rawBody();
            List<MacroBody.Segment> segments = new ArrayList<>();
            int literalStart = 0;

            for (ReferenceToken token : ReferenceScanner.scan(raw)) {
                Optional<MacroDefinition> target = table.get(token.name())
                        .filter(t -> t.id() < definition.id());
                if (target.isEmpty()) {
                    throw new UndefinedReferenceException(definition.name(), token.name(),
                            new SourceInfo(sourceName, definition.sourceLine()));
                }
                if (token.marked()) {
                    diagnostics.reportWarning("Visibility marker has no meaning at a reference; $(!"
                                    + token.name() + ") is treated as $(" + token.name() + ")",
                            sourceName, definition.sourceLine(), definition.name());
                }
                if (token.start() > literalStart) {
                    segments.add(MacroBody.Segment.literal(raw.substring(literalStart, token.start())));
                }
                segments.add(MacroBody.Segment.reference(token.name(), target.get().id()));
                edges.add(new DependencyEdge(definition.name(), token.name()));
                literalStart = token.end();
            }
            if (literalStart < raw.length()) {
                segments.add(MacroBody.Segment.literal(raw.substring(literalStart)));
            }
            bodies.add(new MacroBody(definition.id(), segments));
        }

        verifyBackwardEdges(table, bodies);
        return new DependencyGraph(bodies, edges);
    }

    private static void verifyBackwardEdges(MacroTable table, List<MacroBody> bodies) {
        for (MacroBody body : bodies) {
            for (MacroBody.Segment segment : body.segments()) {
                if (segment.isReference() && segment.referenceId() >= body.macroId()) {
                    throw new InternalExpansionInvariantError("Reference from '" + table.byId(body.macroId()).name()
                            + "' to '" + segment.text() + "' does not point to an earlier definition");
                }
            }
        }
    }
}
