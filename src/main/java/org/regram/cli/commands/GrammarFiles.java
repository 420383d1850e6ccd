package org.regram.cli.commands;

import org.regram.compiler.api.CompiledGrammar;
import org.regram.compiler.api.GrammarCompiler;
import org.regram.compiler.api.GrammarErrorCode;
import org.regram.compiler.api.GrammarException;

import java.io.File;
import java.io.IOException;

/**
 * Compiles grammar files named on the command line.
 */
final class GrammarFiles {

    private GrammarFiles() {
    }

    /**
     * Reads and compiles a grammar file.
     *
     * @param compiler The compiler.
     * @param file     The grammar file.
     * @return The compiled grammar.
     * @throws GrammarException if the file cannot be read or the grammar cannot be compiled.
     */
    static CompiledGrammar compile(GrammarCompiler compiler, File file) throws GrammarException {
        try {
            return compiler.compile(file.toPath());
        } catch (IOException e) {
            throw new GrammarException(GrammarErrorCode.IO_ERROR_READING_FILE,
                    "Cannot read grammar file " + file + ": " + e.getMessage(), e);
        }
    }
}
