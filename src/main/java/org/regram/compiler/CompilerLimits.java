package org.regram.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Set;
import java.util.TreeSet;

/**
 * Ceilings that guard the compiler against pathological grammars.
 *
 * @param maxMacroCount     Maximum number of macro definitions in one grammar.
 * @param maxTotalBodySize  Maximum sum of raw body lengths, in characters.
 * @param maxExpandedLength Maximum length of any single expanded macro, in characters; at most
 *                          {@link Integer#MAX_VALUE}.
 */
public record CompilerLimits(int maxMacroCount, long maxTotalBodySize, long maxExpandedLength) {

    static final String MAX_MACRO_COUNT = "max-macro-count";
    static final String MAX_TOTAL_BODY_SIZE = "max-total-body-size";
    static final String MAX_EXPANDED_LENGTH = "max-expanded-length";

    private static final Set<String> KNOWN_KEYS = Set.of(MAX_MACRO_COUNT, MAX_TOTAL_BODY_SIZE, MAX_EXPANDED_LENGTH);

    public CompilerLimits {
        if (maxMacroCount <= 0 || maxTotalBodySize <= 0 || maxExpandedLength <= 0) {
            throw new IllegalArgumentException("Compiler limits must be positive: " + maxMacroCount + ", "
                    + maxTotalBodySize + ", " + maxExpandedLength);
        }
        // an expansion is a single String
        maxExpandedLength = Math.min(maxExpandedLength, Integer.MAX_VALUE);
    }

    /**
     * Reads the limits from a {@code regram.compiler.limits} section.
     * @param limits The limits section.
     * @return The limits.
     * @throws IllegalArgumentException if the section contains an unknown key.
     * @throws com.typesafe.config.ConfigException if a value is missing or malformed.
     */
    public static CompilerLimits fromConfig(Config limits) {
        Set<String> unknown = new TreeSet<>(limits.root().keySet());
        unknown.removeAll(KNOWN_KEYS);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unrecognized compiler limit(s): " + unknown);
        }
        return new CompilerLimits(
                limits.getInt(MAX_MACRO_COUNT),
                limits.getLong(MAX_TOTAL_BODY_SIZE),
                limits.getLong(MAX_EXPANDED_LENGTH));
    }

    /**
     * Gets the limits declared in {@code reference.conf}.
     * @return The default limits.
     */
    public static CompilerLimits defaults() {
        return fromConfig(ConfigFactory.defaultReference().getConfig("regram.compiler.limits"));
    }
}
