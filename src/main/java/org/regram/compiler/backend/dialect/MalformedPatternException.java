package org.regram.compiler.backend.dialect;

/**
 * Thrown by {@link PatternScanner} when parentheses or brackets of a pattern do not balance.
 */
public class MalformedPatternException extends Exception {

    private final String reason;
    private final int offset;

    public MalformedPatternException(String reason, int offset) {
        super(reason + " at offset " + offset);
        this.reason = reason;
        this.offset = offset;
    }

    public String getReason() {
        return reason;
    }

    public int getOffset() {
        return offset;
    }
}
