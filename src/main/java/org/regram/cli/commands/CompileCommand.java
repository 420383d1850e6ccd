package org.regram.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import org.regram.cli.CommandLineInterface;
import org.regram.compiler.DialectPresets;
import org.regram.compiler.GrammarCompilers;
import org.regram.compiler.api.AdaptOptions;
import org.regram.compiler.api.CompiledGrammar;
import org.regram.compiler.api.CompiledPattern;
import org.regram.compiler.api.DialectProfile;
import org.regram.compiler.api.RegramException;
import org.regram.compiler.diagnostics.Diagnostic;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Compiles a grammar file and prints its macros adapted to a dialect.
 */
@Command(name = "compile", description = "Compiles a grammar and prints its macros adapted to a dialect.")
public class CompileCommand implements Callable<Integer> {

    static final String DEFAULT_DIALECT_PATH = "regram.cli.default-dialect";

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the grammar file.")
    private File file;

    @Option(names = {"-d", "--dialect"}, description = "The dialect preset (default: regram.cli.default-dialect).")
    private String dialect;

    @Option(names = {"-m", "--macro"}, description = "A macro to print; repeatable (default: all public macros).")
    private List<String> macros = new ArrayList<>();

    @Option(names = {"--all"}, description = "Print internal macros too.")
    private boolean all;

    @Option(names = {"--non-capturing-names"},
            description = "Turn named groups into non-capturing groups when the dialect lacks named captures.")
    private boolean namedGroupsAsNonCapturing;

    @Option(names = {"--disambiguate"},
            description = "Rename repeated group names (G2, G3, ...) when the dialect forbids duplicates.")
    private boolean disambiguate;

    @Option(names = {"--json"}, description = "Print the result as JSON.")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        String dialectName = dialect != null ? dialect : config.getString(DEFAULT_DIALECT_PATH);
        DialectPresets presets = DialectPresets.fromConfig(config);
        DialectProfile profile = presets.get(dialectName).orElseThrow(() -> new ParameterException(
                spec.commandLine(), "Unknown dialect '" + dialectName + "'. Known dialects: " + presets.names()));

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            CompiledGrammar grammar = GrammarFiles.compile(GrammarCompilers.create(config), file);
            List<String> names = !macros.isEmpty() ? macros : all ? grammar.macroNames() : grammar.publicMacroNames();
            AdaptOptions options = new AdaptOptions(namedGroupsAsNonCapturing, disambiguate);

            List<CompiledPattern> patterns = new ArrayList<>(names.size());
            for (String name : names) {
                patterns.add(grammar.pattern(name, profile, options));
            }

            if (json) {
                Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
                out.println(gson.toJson(toOutput(dialectName, grammar, patterns)));
            } else {
                for (CompiledPattern pattern : patterns) {
                    out.println(pattern.name() + " = " + pattern.finalText());
                }
            }
            out.flush();
            return 0;
        } catch (RegramException e) {
            err.println("error: " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        }
    }

    private CompileOutput toOutput(String dialectName, CompiledGrammar grammar, List<CompiledPattern> patterns) {
        List<PatternOutput> outputs = patterns.stream()
                .map(p -> new PatternOutput(p.name(), p.finalText(), p.groupCount(), p.groupNameToIndex()))
                .toList();
        List<String> warnings = grammar.warnings().stream().map(Diagnostic::toString).toList();
        return new CompileOutput(file.getName(), dialectName, outputs, warnings);
    }

    record CompileOutput(String grammar, String dialect, List<PatternOutput> patterns, List<String> warnings) {
    }

    record PatternOutput(String name, String pattern, int groupCount, Map<String, Integer> groups) {
    }
}
