package org.regram.compiler.backend.dialect;

/**
 * A parenthesized construct of a pattern.
 *
 * @param kind       What the group does.
 * @param start      Offset of the opening parenthesis.
 * @param headerEnd  Offset just past the group header, e.g. past {@code (?<name>} or {@code (?:}.
 * @param end        Offset of the closing parenthesis.
 * @param name       The capture name for {@link Kind#NAMED} groups, otherwise null.
 * @param namePrefix The header text before the name, e.g. {@code (?<} or {@code (?P<}; null if unnamed.
 * @param nameSuffix The header text after the name, e.g. {@code >} or {@code '}; null if unnamed.
 */
public record GroupToken(
        Kind kind,
        int start,
        int headerEnd,
        int end,
        String name,
        String namePrefix,
        String nameSuffix
) {

    /**
     * Group kinds relevant to dialect adaptation.
     */
    public enum Kind {
        /** A plain {@code (...)} group. */
        CAPTURING,
        /** A named capture in any of the {@code (?<n>}, {@code (?P<n>} or {@code (?'n'} spellings. */
        NAMED,
        /** A {@code (?:...)} group. */
        NON_CAPTURING,
        /** A {@code (?<=...)} or {@code (?<!...)} assertion. */
        LOOKBEHIND,
        /** Any other construct: lookahead, atomic group, inline flags, verbs. */
        OTHER
    }

    public boolean captures() {
        return kind == Kind.CAPTURING || kind == Kind.NAMED;
    }
}
