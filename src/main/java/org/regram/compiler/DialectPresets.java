package org.regram.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.regram.compiler.api.DialectProfile;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Named dialect profiles read from the {@code regram.dialects} configuration section.
 */
public final class DialectPresets {

    public static final String CONFIG_PATH = "regram.dialects";

    private final Map<String, DialectProfile> presets;

    private DialectPresets(Map<String, DialectProfile> presets) {
        this.presets = Collections.unmodifiableMap(presets);
    }

    /**
     * Reads the presets of a configuration.
     * @param config A root configuration, falling back to {@code reference.conf} for missing entries.
     * @return The presets.
     * @throws IllegalArgumentException if a preset contains an unrecognized option or a non-boolean value.
     */
    public static DialectPresets fromConfig(Config config) {
        Config section = config.withFallback(ConfigFactory.defaultReference()).resolve().getConfig(CONFIG_PATH);
        Map<String, DialectProfile> presets = new TreeMap<>();
        for (String name : section.root().keySet()) {
            try {
                presets.put(name, DialectProfile.fromConfig(section.getConfig(name)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid dialect preset '" + name + "': " + e.getMessage(), e);
            }
        }
        return new DialectPresets(presets);
    }

    /**
     * Gets the presets declared in {@code reference.conf}.
     * @return The built-in presets.
     */
    public static DialectPresets defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    public Optional<DialectProfile> get(String name) {
        return Optional.ofNullable(presets.get(name));
    }

    /**
     * Gets a preset that must exist.
     * @param name The preset name.
     * @return The profile.
     * @throws IllegalArgumentException if no preset has this name.
     */
    public DialectProfile require(String name) {
        DialectProfile profile = presets.get(name);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown dialect '" + name + "'. Known dialects: " + names());
        }
        return profile;
    }

    /**
     * Gets the preset names in alphabetical order.
     * @return The names.
     */
    public List<String> names() {
        return List.copyOf(presets.keySet());
    }

    public Map<String, DialectProfile> asMap() {
        return presets;
    }
}
