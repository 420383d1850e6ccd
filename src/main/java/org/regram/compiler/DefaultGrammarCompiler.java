package org.regram.compiler;

import org.regram.compiler.api.CompiledGrammar;
import org.regram.compiler.api.CompiledMacro;
import org.regram.compiler.api.GrammarCompiler;
import org.regram.compiler.api.GrammarException;
import org.regram.compiler.api.Visibility;
import org.regram.compiler.backend.dialect.DialectAdapter;
import org.regram.compiler.backend.validate.Validator;
import org.regram.compiler.diagnostics.DiagnosticsEngine;
import org.regram.compiler.frontend.comments.CommentStripper;
import org.regram.compiler.frontend.comments.SourceLine;
import org.regram.compiler.frontend.dependency.DependencyGraph;
import org.regram.compiler.frontend.dependency.DependencyResolver;
import org.regram.compiler.frontend.expander.Expander;
import org.regram.compiler.frontend.parser.DefinitionParser;
import org.regram.compiler.frontend.parser.MacroTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the frontend pipeline from grammar text
 * to a {@link CompiledGrammar}; the backend phases run later, per requested dialect.
 * <p>
 * Instances hold no per-compilation state and may be shared between threads.
 */
public class DefaultGrammarCompiler implements GrammarCompiler {

    private static final Logger log = LoggerFactory.getLogger(DefaultGrammarCompiler.class);

    private final CompilerLimits limits;
    private final DialectAdapter adapter;
    private final Validator validator;

    /**
     * Creates a compiler with the limits declared in {@code reference.conf}.
     */
    public DefaultGrammarCompiler() {
        this(CompilerLimits.defaults());
    }

    public DefaultGrammarCompiler(CompilerLimits limits) {
        this(limits, new DialectAdapter(), new Validator());
    }

    /**
     * Creates a compiler with explicit backend phases, which the compiled grammars it produces will use.
     *
     * @param limits    The resource limits.
     * @param adapter   The dialect adapter.
     * @param validator The validator.
     */
    public DefaultGrammarCompiler(CompilerLimits limits, DialectAdapter adapter, Validator validator) {
        this.limits = limits;
        this.adapter = adapter;
        this.validator = validator;
    }

    @Override
    public CompiledGrammar compile(List<String> sourceLines, String sourceName) throws GrammarException {
        long start = System.nanoTime();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: comments
        List<SourceLine> lines = new CommentStripper(sourceName).strip(String.join("\n", sourceLines));
        log.debug("{}: {} of {} lines remain after comment stripping", sourceName, lines.size(), sourceLines.size());

        // Phase 2: definitions
        MacroTable table = new DefinitionParser(sourceName, limits).parse(lines);
        log.debug("{}: parsed {} macro definitions", sourceName, table.size());

        // Phase 3: references
        DependencyGraph graph = new DependencyResolver(sourceName, diagnostics).resolve(table);
        log.debug("{}: resolved {} references", sourceName, graph.edges().size());

        // Phase 4: expansion
        List<CompiledMacro> macros = new Expander(sourceName, limits).expand(table, graph);

        long publicCount = macros.stream().filter(m -> m.visibility() == Visibility.PUBLIC).count();
        log.info("Compiled {}: {} macros ({} public), {} warnings in {} ms", sourceName, macros.size(), publicCount,
                diagnostics.getWarnings().size(), (System.nanoTime() - start) / 1_000_000);

        return new DefaultCompiledGrammar(sourceName, graph, macros, diagnostics.getWarnings(), adapter, validator);
    }
}
