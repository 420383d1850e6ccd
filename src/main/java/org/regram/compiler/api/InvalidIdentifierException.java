package org.regram.compiler.api;

/**
 * A macro definition uses a name that is not a valid identifier.
 */
public class InvalidIdentifierException extends GrammarException {

    public InvalidIdentifierException(String name, SourceInfo sourceInfo) {
        super(GrammarErrorCode.INVALID_IDENTIFIER,
                "Invalid macro name '" + name + "': expected a letter or '_' followed by letters, digits or '_'",
                sourceInfo, name);
    }
}
