package org.regram.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.regram.compiler.api.GrammarCompiler;

/**
 * Factory for the default {@link GrammarCompiler}.
 */
public final class GrammarCompilers {

    public static final String LIMITS_PATH = "regram.compiler.limits";

    private GrammarCompilers() {
    }

    /**
     * Creates a compiler configured from {@code reference.conf}.
     * @return The compiler.
     */
    public static GrammarCompiler create() {
        return create(ConfigFactory.empty());
    }

    /**
     * Creates a compiler configured from a root configuration.
     * Entries missing from {@code config} are taken from {@code reference.conf}.
     *
     * @param config The configuration.
     * @return The compiler.
     * @throws IllegalArgumentException if the limits section contains an unknown key or a non-positive value.
     */
    public static GrammarCompiler create(Config config) {
        Config resolved = config.withFallback(ConfigFactory.defaultReference()).resolve();
        return new DefaultGrammarCompiler(CompilerLimits.fromConfig(resolved.getConfig(LIMITS_PATH)));
    }
}
