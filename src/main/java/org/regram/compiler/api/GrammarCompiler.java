package org.regram.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the grammar compiler.
 * <p>
 * An implementation takes the text of a macro grammar and, on success, returns an immutable
 * {@link CompiledGrammar} holding every macro fully expanded. Any error in the grammar is raised
 * as a {@link GrammarException}; compilation stops at the first one.
 * <p>
 * This interface decouples callers from the internal pipeline of the compiler.
 */
public interface GrammarCompiler {

    /**
     * Compiles a grammar.
     *
     * @param sourceLines The lines of the grammar text.
     * @param sourceName  A name for the grammar, used in error messages.
     * @return The compiled grammar.
     * @throws GrammarException if the grammar is malformed, references undefined macros or exceeds a limit.
     */
    CompiledGrammar compile(List<String> sourceLines, String sourceName) throws GrammarException;

    /**
     * Compiles a grammar given as a single text blob.
     *
     * @param grammarText The grammar text.
     * @return The compiled grammar.
     * @throws GrammarException if the grammar cannot be compiled.
     */
    default CompiledGrammar compile(String grammarText) throws GrammarException {
        return compile(grammarText.lines().toList(), "<grammar>");
    }

    /**
     * Compiles a UTF-8 grammar file.
     *
     * @param grammarFile The path of the grammar file.
     * @return The compiled grammar.
     * @throws GrammarException if the grammar cannot be compiled.
     * @throws IOException if the file cannot be read.
     */
    default CompiledGrammar compile(Path grammarFile) throws GrammarException, IOException {
        return compile(Files.readAllLines(grammarFile, StandardCharsets.UTF_8), grammarFile.toString().replace('\\', '/'));
    }
}
