package org.regram.compiler.backend.dialect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Single-pass structural scanner for regular expressions in the common Perl-derived syntax.
 * <p>
 * It does not validate or interpret the pattern beyond what dialect adaptation needs: it finds groups
 * (with their kind and name), numbered and named backreferences, and verifies that parentheses and
 * character classes balance. Escapes, {@code \Q...\E} quoting, inline comments {@code (?#...)} and
 * character class contents are skipped. Within a class, {@code [} is a literal except for POSIX
 * brackets such as {@code [:alpha:]}, and a {@code ]} directly after {@code [} or {@code [^} is a member.
 */
public final class PatternScanner {

    private PatternScanner() {
    }

    /**
     * Scans a pattern.
     * @param text The pattern text.
     * @return The structure of the pattern.
     * @throws MalformedPatternException if a group or class is not closed, or a {@code )} has no opener.
     */
    public static PatternStructure scan(String text) throws MalformedPatternException {
        List<GroupToken> groups = new ArrayList<>();
        List<Backreference> backreferences = new ArrayList<>();
        Deque<OpenGroup> open = new ArrayDeque<>();
        int n = text.length();
        int i = 0;

        while (i < n) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> i = scanEscape(text, i, backreferences);
                case '[' -> {
                    int end = classEnd(text, i);
                    if (end < 0) {
                        throw new MalformedPatternException("Unclosed '['", i);
                    }
                    i = end;
                }
                case ')' -> {
                    if (open.isEmpty()) {
                        throw new MalformedPatternException("Unmatched ')'", i);
                    }
                    groups.add(open.pop().close(i));
                    i++;
                }
                case '(' -> i = openGroup(text, i, open, backreferences);
                default -> i++;
            }
        }
        if (!open.isEmpty()) {
            throw new MalformedPatternException("Unclosed '('", open.peek().start);
        }
        groups.sort(Comparator.comparingInt(GroupToken::start));
        return new PatternStructure(text, groups, backreferences);
    }

    /**
     * Returns the offset just past an escape sequence starting at {@code i}, recording backreferences.
     */
    private static int scanEscape(String text, int i, List<Backreference> backreferences) {
        int n = text.length();
        if (i + 1 >= n) return n;
        char next = text.charAt(i + 1);
        if (next == 'Q') {
            int quoteEnd = text.indexOf("\\E", i + 2);
            return quoteEnd < 0 ? n : quoteEnd + 2;
        }
        if (next >= '1' && next <= '9') {
            int end = i + 2;
            while (end < n && Character.isDigit(text.charAt(end))) end++;
            backreferences.add(new Backreference(i, end, parseGroupNumber(text.substring(i + 1, end)), null));
            return end;
        }
        if (next == 'k' && i + 2 < n) {
            char open = text.charAt(i + 2);
            char close = switch (open) {
                case '<' -> '>';
                case '\'' -> '\'';
                case '{' -> '}';
                default -> 0;
            };
            if (close != 0) {
                int nameEnd = text.indexOf(close, i + 3);
                if (nameEnd > i + 3) {
                    backreferences.add(new Backreference(i, nameEnd + 1, 0, text.substring(i + 3, nameEnd)));
                    return nameEnd + 1;
                }
            }
        }
        return i + 2;
    }

    /**
     * Parses the digits of a numbered backreference.
     * @return The group number, or {@link Backreference#OUT_OF_RANGE} if it does not fit an {@code int}.
     */
    private static int parseGroupNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Backreference.OUT_OF_RANGE;
        }
    }

    /**
     * Finds the end of the character class starting at {@code i}.
     * @param text The pattern text.
     * @param i    Offset of the opening {@code [}.
     * @return The offset just past the closing {@code ]}, or -1 if the class is not closed.
     */
    static int classEnd(String text, int i) {
        int n = text.length();
        int j = i + 1;
        if (j < n && text.charAt(j) == '^') j++;
        if (j < n && text.charAt(j) == ']') j++;
        while (j < n) {
            char c = text.charAt(j);
            if (c == '\\') {
                if (j + 1 < n && text.charAt(j + 1) == 'Q') {
                    int quoteEnd = text.indexOf("\\E", j + 2);
                    j = quoteEnd < 0 ? n : quoteEnd + 2;
                } else {
                    j += 2;
                }
            } else if (c == '[' && j + 1 < n && text.charAt(j + 1) == ':') {
                int posixEnd = text.indexOf(":]", j + 2);
                j = posixEnd < 0 ? j + 1 : posixEnd + 2;
            } else if (c == ']') {
                return j + 1;
            } else {
                j++;
            }
        }
        return -1;
    }

    private static int openGroup(String text, int i, Deque<OpenGroup> open, List<Backreference> backreferences)
            throws MalformedPatternException {
        int n = text.length();
        if (i + 1 < n && text.charAt(i + 1) == '*') {
            open.push(new OpenGroup(GroupToken.Kind.OTHER, i, i + 2, null, null, null));
            return i + 2;
        }
        if (i + 1 >= n || text.charAt(i + 1) != '?') {
            open.push(new OpenGroup(GroupToken.Kind.CAPTURING, i, i + 1, null, null, null));
            return i + 1;
        }
        char c2 = i + 2 < n ? text.charAt(i + 2) : 0;
        char c3 = i + 3 < n ? text.charAt(i + 3) : 0;

        if (c2 == '#') {
            int commentEnd = text.indexOf(')', i + 3);
            if (commentEnd < 0) throw new MalformedPatternException("Unclosed '(?#'", i);
            return commentEnd + 1;
        }
        if (c2 == 'P' && c3 == '=') {
            int nameEnd = text.indexOf(')', i + 4);
            if (nameEnd < 0) throw new MalformedPatternException("Unclosed '(?P='", i);
            backreferences.add(new Backreference(i, nameEnd + 1, 0, text.substring(i + 4, nameEnd)));
            return nameEnd + 1;
        }
        if (c2 == '<' && (c3 == '=' || c3 == '!')) {
            open.push(new OpenGroup(GroupToken.Kind.LOOKBEHIND, i, i + 4, null, null, null));
            return i + 4;
        }
        if (c2 == '<' || c2 == '\'' || (c2 == 'P' && c3 == '<')) {
            int nameStart = c2 == 'P' ? i + 4 : i + 3;
            char terminator = c2 == '\'' ? '\'' : '>';
            int nameEnd = text.indexOf(terminator, nameStart);
            if (nameEnd > nameStart) {
                String prefix = text.substring(i, nameStart);
                open.push(new OpenGroup(GroupToken.Kind.NAMED, i, nameEnd + 1,
                        text.substring(nameStart, nameEnd), prefix, String.valueOf(terminator)));
                return nameEnd + 1;
            }
        }
        if (c2 == ':') {
            open.push(new OpenGroup(GroupToken.Kind.NON_CAPTURING, i, i + 3, null, null, null));
            return i + 3;
        }
        open.push(new OpenGroup(GroupToken.Kind.OTHER, i, i + 2, null, null, null));
        return i + 2;
    }

    private record OpenGroup(GroupToken.Kind kind, int start, int headerEnd, String name,
                             String namePrefix, String nameSuffix) {

        GroupToken close(int end) {
            return new GroupToken(kind, start, headerEnd, end, name, namePrefix, nameSuffix);
        }
    }
}
