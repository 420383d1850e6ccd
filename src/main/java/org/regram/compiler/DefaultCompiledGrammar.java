package org.regram.compiler;

import org.regram.compiler.api.AdaptOptions;
import org.regram.compiler.api.CompiledGrammar;
import org.regram.compiler.api.CompiledMacro;
import org.regram.compiler.api.CompiledPattern;
import org.regram.compiler.api.DialectException;
import org.regram.compiler.api.DialectProfile;
import org.regram.compiler.api.GrammarErrorCode;
import org.regram.compiler.api.Visibility;
import org.regram.compiler.backend.dialect.AdaptedPattern;
import org.regram.compiler.backend.dialect.DialectAdapter;
import org.regram.compiler.backend.validate.ValidationReport;
import org.regram.compiler.backend.validate.Validator;
import org.regram.compiler.diagnostics.Diagnostic;
import org.regram.compiler.frontend.dependency.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * A compiled grammar with a per-key cache of adapted patterns.
 * <p>
 * All frontend results are frozen at construction. Adaptation is deterministic, so each
 * (macro, profile, options) key is adapted at most once: the first caller runs the adaptation and
 * concurrent callers for the same key wait for its result. Failures are cached like results.
 */
public class DefaultCompiledGrammar implements CompiledGrammar {

    private static final Logger log = LoggerFactory.getLogger(DefaultCompiledGrammar.class);

    private final String sourceName;
    private final DependencyGraph graph;
    private final Map<String, CompiledMacro> macros;
    private final List<Diagnostic> warnings;
    private final DialectAdapter adapter;
    private final Validator validator;
    private final ConcurrentMap<PatternKey, FutureTask<CompiledPattern>> patterns = new ConcurrentHashMap<>();

    DefaultCompiledGrammar(String sourceName, DependencyGraph graph, List<CompiledMacro> macros,
                           List<Diagnostic> warnings, DialectAdapter adapter, Validator validator) {
        this.sourceName = sourceName;
        this.graph = graph;
        Map<String, CompiledMacro> byName = new LinkedHashMap<>();
        for (CompiledMacro macro : macros) {
            byName.put(macro.name(), macro);
        }
        this.macros = Collections.unmodifiableMap(byName);
        this.warnings = List.copyOf(warnings);
        this.adapter = adapter;
        this.validator = validator;
    }

    @Override
    public CompiledPattern pattern(String name, DialectProfile profile, AdaptOptions options) throws DialectException {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(options, "options");
        CompiledMacro macro = macros.get(name);
        if (macro == null) {
            throw new DialectException(GrammarErrorCode.UNKNOWN_MACRO, name,
                    "No macro with this name is defined in " + sourceName);
        }

        PatternKey key = new PatternKey(name, profile, options);
        FutureTask<CompiledPattern> task = patterns.get(key);
        if (task == null) {
            FutureTask<CompiledPattern> created = new FutureTask<>(() -> adapt(macro, profile, options));
            task = patterns.putIfAbsent(key, created);
            if (task == null) {
                task = created;
                created.run();
            }
        }

        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for macro '" + name + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DialectException dialectException) {
                throw dialectException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Adaptation of macro '" + name + "' failed", cause);
        }
    }

    private CompiledPattern adapt(CompiledMacro macro, DialectProfile profile, AdaptOptions options)
            throws DialectException {
        AdaptedPattern adapted = adapter.adapt(macro.name(), macro.expandedBody(), profile, options);
        ValidationReport report = validator.validate(macro.name(), adapted, profile);
        log.debug("Built pattern for '{}' with {} capture groups for {}", macro.name(), report.captureCount(), profile);
        return new CompiledPattern(macro.name(), profile, adapted.text(), adapted.groupNameToIndex(),
                report.captureGroups());
    }

    @Override
    public Optional<CompiledMacro> macro(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    @Override
    public List<String> macroNames() {
        return List.copyOf(macros.keySet());
    }

    @Override
    public List<String> publicMacroNames() {
        return macros.values().stream()
                .filter(m -> m.visibility() == Visibility.PUBLIC)
                .map(CompiledMacro::name)
                .toList();
    }

    @Override
    public List<String> dependenciesOf(String name) {
        return graph.dependenciesOf(name);
    }

    @Override
    public List<Diagnostic> warnings() {
        return warnings;
    }

    @Override
    public List<String> dependentsOf(String name) {
        return graph.dependentsOf(name);
    }

    private record PatternKey(String name, DialectProfile profile, AdaptOptions options) {
    }
}
