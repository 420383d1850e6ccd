package org.regram.compiler.api;

/**
 * The expanded pattern contains a construct the target dialect cannot express, such as a
 * variable-length lookbehind, or its group structure is unbalanced.
 * The construct is reported, never rewritten.
 */
public class UnsupportedConstructException extends DialectException {

    private final String construct;
    private final int offset;

    public UnsupportedConstructException(String macroName, String construct, int offset, String reason) {
        super(GrammarErrorCode.UNSUPPORTED_CONSTRUCT, macroName,
                String.format("%s at offset %d: %s", reason, offset, construct));
        this.construct = construct;
        this.offset = offset;
    }

    /**
     * Gets the text of the offending construct.
     * @return The construct as it appears in the pattern.
     */
    public String getConstruct() {
        return construct;
    }

    /**
     * Gets the 0-based offset of the construct in the pattern text.
     * @return The offset.
     */
    public int getOffset() {
        return offset;
    }
}
