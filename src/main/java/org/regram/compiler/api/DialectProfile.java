package org.regram.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Capability descriptor of a target regex engine, consulted once per adaptation.
 * <p>
 * Exactly four options are recognized. The map and {@link Config} factories accept each option under its
 * kebab-case key (as used in HOCON files) or its camelCase key; any other key is rejected with an
 * {@link IllegalArgumentException} instead of being ignored. Options that are not given default to {@code false}.
 *
 * @param namedCaptureSupport             The engine supports {@code (?<name>...)} groups.
 * @param duplicateNamedGroupsAllowed     The same group name may occur more than once.
 * @param variableLengthLookbehindSupport Lookbehind content may have variable length.
 * @param explicitCaptureOnly             Only named groups capture; unnamed groups are grouping only.
 */
public record DialectProfile(
        boolean namedCaptureSupport,
        boolean duplicateNamedGroupsAllowed,
        boolean variableLengthLookbehindSupport,
        boolean explicitCaptureOnly
) {

    public static final String NAMED_CAPTURE_SUPPORT = "named-capture-support";
    public static final String DUPLICATE_NAMED_GROUPS_ALLOWED = "duplicate-named-groups-allowed";
    public static final String VARIABLE_LENGTH_LOOKBEHIND_SUPPORT = "variable-length-lookbehind-support";
    public static final String EXPLICIT_CAPTURE_ONLY = "explicit-capture-only";

    private static final Map<String, String> KEY_ALIASES = Map.of(
            NAMED_CAPTURE_SUPPORT, NAMED_CAPTURE_SUPPORT,
            "namedCaptureSupport", NAMED_CAPTURE_SUPPORT,
            DUPLICATE_NAMED_GROUPS_ALLOWED, DUPLICATE_NAMED_GROUPS_ALLOWED,
            "duplicateNamedGroupsAllowed", DUPLICATE_NAMED_GROUPS_ALLOWED,
            VARIABLE_LENGTH_LOOKBEHIND_SUPPORT, VARIABLE_LENGTH_LOOKBEHIND_SUPPORT,
            "variableLengthLookbehindSupport", VARIABLE_LENGTH_LOOKBEHIND_SUPPORT,
            EXPLICIT_CAPTURE_ONLY, EXPLICIT_CAPTURE_ONLY,
            "explicitCaptureOnly", EXPLICIT_CAPTURE_ONLY);

    /**
     * Creates a builder with every option set to {@code false}.
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a profile from option values.
     * @param options Option names mapped to {@link Boolean} values (or the strings "true"/"false").
     * @return The profile.
     * @throws IllegalArgumentException if a key is not one of the four options, an option is given twice
     *                                  under different spellings, or a value is not a boolean.
     */
    public static DialectProfile fromMap(Map<String, ?> options) {
        Map<String, Boolean> resolved = new LinkedHashMap<>();
        Set<String> unknown = new TreeSet<>();
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            String canonical = KEY_ALIASES.get(entry.getKey());
            if (canonical == null) {
                unknown.add(entry.getKey());
                continue;
            }
            if (resolved.containsKey(canonical)) {
                throw new IllegalArgumentException("Dialect option '" + canonical + "' is given more than once");
            }
            resolved.put(canonical, toBoolean(entry.getKey(), entry.getValue()));
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unrecognized dialect option(s) " + unknown
                    + "; recognized options are " + new TreeSet<>(Set.of(NAMED_CAPTURE_SUPPORT,
                    DUPLICATE_NAMED_GROUPS_ALLOWED, VARIABLE_LENGTH_LOOKBEHIND_SUPPORT, EXPLICIT_CAPTURE_ONLY)));
        }
        return new DialectProfile(
                resolved.getOrDefault(NAMED_CAPTURE_SUPPORT, false),
                resolved.getOrDefault(DUPLICATE_NAMED_GROUPS_ALLOWED, false),
                resolved.getOrDefault(VARIABLE_LENGTH_LOOKBEHIND_SUPPORT, false),
                resolved.getOrDefault(EXPLICIT_CAPTURE_ONLY, false));
    }

    /**
     * Creates a profile from a HOCON section such as {@code regram.dialects.java}.
     * @param config The section holding the options.
     * @return The profile.
     * @throws IllegalArgumentException if the section contains an unrecognized key or a non-boolean value.
     */
    public static DialectProfile fromConfig(Config config) {
        Map<String, Object> options = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.root().entrySet()) {
            ConfigValue value = entry.getValue();
            if (value.valueType() == ConfigValueType.BOOLEAN) {
                options.put(entry.getKey(), value.unwrapped());
            } else {
                options.put(entry.getKey(), String.valueOf(value.unwrapped()));
            }
        }
        return fromMap(options);
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(s);
        }
        throw new IllegalArgumentException("Dialect option '" + key + "' must be a boolean, got: " + value);
    }

    /**
     * Gets the options of this profile keyed by their kebab-case names.
     * @return The four options, in declaration order.
     */
    public Map<String, Boolean> toMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        map.put(NAMED_CAPTURE_SUPPORT, namedCaptureSupport);
        map.put(DUPLICATE_NAMED_GROUPS_ALLOWED, duplicateNamedGroupsAllowed);
        map.put(VARIABLE_LENGTH_LOOKBEHIND_SUPPORT, variableLengthLookbehindSupport);
        map.put(EXPLICIT_CAPTURE_ONLY, explicitCaptureOnly);
        return map;
    }

    /**
     * Builder for {@link DialectProfile}.
     */
    public static final class Builder {
        private boolean namedCaptureSupport;
        private boolean duplicateNamedGroupsAllowed;
        private boolean variableLengthLookbehindSupport;
        private boolean explicitCaptureOnly;

        private Builder() {
        }

        public Builder namedCaptureSupport(boolean value) {
            this.namedCaptureSupport = value;
            return this;
        }

        public Builder duplicateNamedGroupsAllowed(boolean value) {
            this.duplicateNamedGroupsAllowed = value;
            return this;
        }

        public Builder variableLengthLookbehindSupport(boolean value) {
            this.variableLengthLookbehindSupport = value;
            return this;
        }

        public Builder explicitCaptureOnly(boolean value) {
            this.explicitCaptureOnly = value;
            return this;
        }

        public DialectProfile build() {
            return new DialectProfile(namedCaptureSupport, duplicateNamedGroupsAllowed,
                    variableLengthLookbehindSupport, explicitCaptureOnly);
        }
    }
}
