package org.regram.compiler.backend.dialect;

/**
 * A backreference to an earlier group, numbered ({@code \1}) or named ({@code \k<n>}, {@code (?P=n)}).
 *
 * @param start  Offset of the first character of the backreference.
 * @param end    Offset just past its last character.
 * @param number The referenced group number, 0 for a named backreference, or {@link #OUT_OF_RANGE} if the
 *               written number does not fit an {@code int}.
 * @param name   The referenced group name, or null for a numbered backreference.
 */
public record Backreference(int start, int end, int number, String name) {

    /** Number of a backreference too large to name any group. */
    public static final int OUT_OF_RANGE = Integer.MAX_VALUE;

    public boolean isNamed() {
        return name != null;
    }
}
