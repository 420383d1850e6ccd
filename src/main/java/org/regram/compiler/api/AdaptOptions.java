package org.regram.compiler.api;

/**
 * Caller intent that modifies dialect adaptation without being a capability of the engine.
 *
 * @param namedGroupsAsNonCapturing   When the dialect lacks named captures, rewrite named groups to
 *                                    non-capturing groups instead of plain capturing groups.
 * @param disambiguateDuplicateGroups When the dialect forbids duplicate group names, rename the second and
 *                                    later occurrences ({@code G2}, {@code G3}, ...) instead of failing.
 *                                    Renaming changes how callers address groups, so it is opt-in.
 */
public record AdaptOptions(boolean namedGroupsAsNonCapturing, boolean disambiguateDuplicateGroups) {

    /** No rewriting beyond what the profile requires. */
    public static final AdaptOptions DEFAULTS = new AdaptOptions(false, false);
}
