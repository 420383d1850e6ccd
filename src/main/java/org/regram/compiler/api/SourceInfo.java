package org.regram.compiler.api;

/**
 * Identifies a location in a grammar text.
 *
 * @param sourceName The logical name of the grammar (file path or a caller supplied label).
 * @param lineNumber The 1-based line number.
 */
public record SourceInfo(String sourceName, int lineNumber) {

    @Override
    public String toString() {
        return sourceName + ":" + lineNumber;
    }
}
