package org.regram.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the command line entry point in-process and checks output and exit codes.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private Path grammar;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        grammar = tempDir.resolve("dates.grammar");
        Files.write(grammar, List.of(
                "// dates",
                "$(!d2)=[0-9]{2}",
                "$(!d4)=[0-9]{4}",
                "$(date)=(?<year>$(d4))-(?<month>$(d2))",
                "$(stamp)=$(date)T(?<hour>$(d2))"));
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    @Tag("unit")
    void commandNameIsRegram() {
        assertThat(CommandLineInterface.createCommandLine().getCommandName()).isEqualTo("regram");
    }

    @Test
    @Tag("integration")
    void compilePrintsPublicMacrosForDefaultDialect() {
        int exitCode = run("compile", "-f", grammar.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "date = (?<year>[0-9]{4})-(?<month>[0-9]{2})",
                "stamp = (?<year>[0-9]{4})-(?<month>[0-9]{2})T(?<hour>[0-9]{2})");
    }

    @Test
    @Tag("integration")
    void compileSelectedMacroForLegacyDialect() {
        int exitCode = run("compile", "-f", grammar.toString(), "-d", "legacy", "-m", "date");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("date = ([0-9]{4})-([0-9]{2})");
    }

    @Test
    @Tag("integration")
    void compileAllIncludesInternalMacros() {
        int exitCode = run("compile", "-f", grammar.toString(), "--all");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("d2 = [0-9]{2}", "d4 = [0-9]{4}");
    }

    @Test
    @Tag("integration")
    void compileJsonReportsGroupIndices() {
        int exitCode = run("compile", "-f", grammar.toString(), "-d", "legacy", "-m", "stamp", "--json");

        assertThat(exitCode).isZero();
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.get("dialect").getAsString()).isEqualTo("legacy");
        JsonObject pattern = json.getAsJsonArray("patterns").get(0).getAsJsonObject();
        assertThat(pattern.get("pattern").getAsString()).isEqualTo("([0-9]{4})-([0-9]{2})T([0-9]{2})");
        assertThat(pattern.get("groupCount").getAsInt()).isEqualTo(3);
        assertThat(pattern.getAsJsonObject("groups").get("hour").getAsInt()).isEqualTo(3);
    }

    @Test
    @Tag("integration")
    void grammarErrorExitsWithOne() throws Exception {
        Path broken = tempDir.resolve("broken.grammar");
        Files.write(broken, List.of("$(A)=a$(B)", "$(B)=b"));

        int exitCode = run("compile", "-f", broken.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("error:").contains(":1:").contains("'B'");
    }

    @Test
    @Tag("integration")
    void dialectErrorExitsWithOne() throws Exception {
        Path duplicates = tempDir.resolve("duplicates.grammar");
        Files.write(duplicates, List.of("$(!w)=(?<G>[a-z]+)", "$(pair)=$(w) $(w)"));

        assertThat(run("compile", "-f", duplicates.toString())).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("'G'");

        assertThat(run("compile", "-f", duplicates.toString(), "--disambiguate")).isZero();
        assertThat(out.toString()).contains("pair = (?<G>[a-z]+) (?<G2>[a-z]+)");
    }

    @Test
    @Tag("integration")
    void missingGrammarFileExitsWithOne() {
        int exitCode = run("compile", "-f", tempDir.resolve("nope.grammar").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("Cannot read grammar file");
    }

    @Test
    @Tag("integration")
    void unknownDialectIsUsageError() {
        int exitCode = run("compile", "-f", grammar.toString(), "-d", "perl");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Unknown dialect 'perl'");
    }

    @Test
    @Tag("unit")
    void missingRequiredOptionIsUsageError() {
        assertThat(run("compile")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    @Tag("integration")
    void dialectsListsPresets() {
        int exitCode = run("dialects");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("legacy").contains("dotnet-explicit").contains("explicit-capture-only=true");
    }

    @Test
    @Tag("integration")
    void depsPrintsEdges() {
        assertThat(run("deps", "-f", grammar.toString())).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "date -> d4", "date -> d2", "stamp -> date", "stamp -> d2");
    }

    @Test
    @Tag("integration")
    void depsForOneMacroPrintsBothDirections() {
        assertThat(run("deps", "-f", grammar.toString(), "-m", "date")).isZero();
        assertThat(out.toString().lines()).containsExactly("stamp -> date", "date -> d4", "date -> d2");
    }

    @Test
    @Tag("integration")
    void configFileSelectsDefaultDialect() throws Exception {
        Path config = tempDir.resolve("regram.conf");
        Files.writeString(config, "regram.cli.default-dialect = legacy\n");

        int exitCode = run("-c", config.toString(), "compile", "-f", grammar.toString(), "-m", "date");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("date = ([0-9]{4})-([0-9]{2})");
    }

    @Test
    @Tag("integration")
    void missingConfigFileExitsWithOne() {
        int exitCode = run("-c", tempDir.resolve("missing.conf").toString(), "dialects");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
