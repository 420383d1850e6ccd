package org.regram.compiler.frontend.dependency;

import java.util.List;

/**
 * A macro body split into literal text and resolved references.
 *
 * @param macroId  The id of the macro owning the body.
 * @param segments The segments in textual order.
 */
public record MacroBody(int macroId, List<Segment> segments) {

    public MacroBody {
        segments = List.copyOf(segments);
    }

    /**
     * One piece of a body: either literal text or a reference to an earlier macro.
     *
     * @param text        The literal text; for a reference, the referenced name.
     * @param referenceId The id of the referenced macro, or {@link #LITERAL} for literal text.
     */
    public record Segment(String text, int referenceId) {

        public static final int LITERAL = -1;

        public static Segment literal(String text) {
            return new Segment(text, LITERAL);
        }

        public static Segment reference(String name, int id) {
            return new Segment(name, id);
        }

        public boolean isReference() {
            return referenceId != LITERAL;
        }
    }
}
