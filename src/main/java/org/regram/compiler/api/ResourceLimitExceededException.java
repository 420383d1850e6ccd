package org.regram.compiler.api;

/**
 * A grammar exceeds one of the configured compiler limits.
 */
public class ResourceLimitExceededException extends GrammarException {

    private final String limitName;
    private final long limit;

    public ResourceLimitExceededException(String limitName, long limit, long actual, SourceInfo sourceInfo, String macroName) {
        super(GrammarErrorCode.RESOURCE_LIMIT_EXCEEDED,
                String.format("Limit '%s' of %d exceeded (%d)", limitName, limit, actual),
                sourceInfo, macroName);
        this.limitName = limitName;
        this.limit = limit;
    }

    public String getLimitName() {
        return limitName;
    }

    public long getLimit() {
        return limit;
    }
}
