package org.regram.cli.commands;

import org.regram.cli.CommandLineInterface;
import org.regram.compiler.GrammarCompilers;
import org.regram.compiler.api.CompiledGrammar;
import org.regram.compiler.api.GrammarException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Prints the reference edges of a grammar as {@code from -> to} lines.
 */
@Command(name = "deps", description = "Prints the dependency edges between the macros of a grammar.")
public class DepsCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the grammar file.")
    private File file;

    @Option(names = {"-m", "--macro"},
            description = "Only print the edges into and out of this macro.")
    private String macro;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            CompiledGrammar grammar = GrammarFiles.compile(GrammarCompilers.create(parent.getConfig()), file);
            if (macro != null) {
                if (grammar.macro(macro).isEmpty()) {
                    throw new ParameterException(spec.commandLine(), "Unknown macro '" + macro + "'");
                }
                grammar.dependentsOf(macro).forEach(from -> out.println(from + " -> " + macro));
                grammar.dependenciesOf(macro).forEach(to -> out.println(macro + " -> " + to));
            } else {
                for (String name : grammar.macroNames()) {
                    grammar.dependenciesOf(name).forEach(to -> out.println(name + " -> " + to));
                }
            }
            out.flush();
            return 0;
        } catch (GrammarException e) {
            err.println("error: " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        }
    }
}
