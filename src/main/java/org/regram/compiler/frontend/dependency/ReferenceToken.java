package org.regram.compiler.frontend.dependency;

/**
 * A {@code $(name)} reference found in a body.
 *
 * @param start  Offset of the {@code $}.
 * @param end    Offset just past the closing parenthesis.
 * @param name   The referenced macro name.
 * @param marked Whether the reference carries the visibility marker, as in {@code $(!name)}.
 */
public record ReferenceToken(int start, int end, String name, boolean marked) {
}
