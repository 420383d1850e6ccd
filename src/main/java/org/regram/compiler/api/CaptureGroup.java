package org.regram.compiler.api;

/**
 * A capturing group of a final pattern.
 *
 * @param index  The 1-based ordinal among capturing groups, counted left to right by opening parenthesis.
 * @param name   The group name, or null for an unnamed group. For dialects without named captures
 *               this is the name the group carried before adaptation.
 * @param offset The 0-based offset of the opening parenthesis in the final text.
 */
public record CaptureGroup(int index, String name, int offset) {

    public boolean isNamed() {
        return name != null;
    }
}
