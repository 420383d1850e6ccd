package org.regram.cli.commands;

import org.regram.cli.CommandLineInterface;
import org.regram.compiler.DialectPresets;
import org.regram.compiler.api.DialectProfile;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Lists the dialect presets known to the configuration.
 */
@Command(name = "dialects", description = "Lists the dialect presets and their capabilities.")
public class DialectsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        DialectPresets presets = DialectPresets.fromConfig(parent.getConfig());
        PrintWriter out = spec.commandLine().getOut();
        for (Map.Entry<String, DialectProfile> entry : presets.asMap().entrySet()) {
            String capabilities = entry.getValue().toMap().entrySet().stream()
                    .map(option -> option.getKey() + "=" + option.getValue())
                    .collect(Collectors.joining(" "));
            out.printf("%-16s %s%n", entry.getKey(), capabilities);
        }
        out.flush();
        return 0;
    }
}
