package org.regram.compiler.api;

/**
 * A line of the grammar is not a well-formed macro definition, or a block comment is never closed.
 */
public class GrammarParseException extends GrammarException {

    public GrammarParseException(String message, SourceInfo sourceInfo) {
        super(GrammarErrorCode.MALFORMED_DEFINITION, message, sourceInfo, null);
    }
}
