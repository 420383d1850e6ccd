package org.regram.compiler.frontend.comments;

/**
 * A grammar line with comments removed.
 *
 * @param lineNumber The 1-based line number in the original text.
 * @param text       The remaining text, stripped of surrounding whitespace and never empty.
 */
public record SourceLine(int lineNumber, String text) {
}
