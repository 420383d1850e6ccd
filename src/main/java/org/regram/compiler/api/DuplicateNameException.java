package org.regram.compiler.api;

/**
 * A macro name is defined twice. Raised against the second definition; the first one stays authoritative.
 */
public class DuplicateNameException extends GrammarException {

    private final int firstDefinitionLine;

    public DuplicateNameException(String name, SourceInfo sourceInfo, int firstDefinitionLine) {
        super(GrammarErrorCode.DUPLICATE_NAME,
                "Macro '" + name + "' is already defined at line " + firstDefinitionLine,
                sourceInfo, name);
        this.firstDefinitionLine = firstDefinitionLine;
    }

    public int getFirstDefinitionLine() {
        return firstDefinitionLine;
    }
}
