package org.regram.compiler.api;

/**
 * A macro body references a name that is not defined before it.
 * <p>
 * Only backward references resolve, so self references and forward references also end here.
 */
public class UndefinedReferenceException extends GrammarException {

    private final String missingName;

    public UndefinedReferenceException(String macroName, String missingName, SourceInfo sourceInfo) {
        super(GrammarErrorCode.UNDEFINED_REFERENCE,
                "Macro '" + macroName + "' references '" + missingName + "', which is not defined before it",
                sourceInfo, macroName);
        this.missingName = missingName;
    }

    /**
     * Gets the referenced name that could not be resolved.
     * @return The missing macro name.
     */
    public String getMissingName() {
        return missingName;
    }
}
