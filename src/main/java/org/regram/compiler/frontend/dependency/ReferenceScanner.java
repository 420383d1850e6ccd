package org.regram.compiler.frontend.dependency;

import org.regram.compiler.frontend.parser.DefinitionParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds reference tokens in macro bodies.
 * <p>
 * A reference is {@code $(} optionally followed by the visibility marker, then an identifier and
 * {@code )}. Anything else starting with {@code $(}, such as an end anchor followed by a group
 * ({@code $(?:...)}), is plain regex text, and {@code \$} is always a literal dollar. References are
 * recognized inside character classes too, so a macro may supply class members.
 */
public final class ReferenceScanner {

    private ReferenceScanner() {
    }

    /**
     * Scans a body for reference tokens.
     * @param body The text to scan.
     * @return The references in order of appearance.
     */
    public static List<ReferenceToken> scan(String body) {
        List<ReferenceToken> tokens = new ArrayList<>();
        int n = body.length();
        int i = 0;
        while (i < n) {
            char c = body.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '$' && i + 1 < n && body.charAt(i + 1) == '(') {
                int nameStart = i + 2;
                boolean marked = nameStart < n && body.charAt(nameStart) == DefinitionParser.INTERNAL_MARKER;
                if (marked) nameStart++;
                int nameEnd = nameStart;
                while (nameEnd < n && isIdentifierPart(body.charAt(nameEnd))) nameEnd++;
                if (nameEnd > nameStart && nameEnd < n && body.charAt(nameEnd) == ')'
                        && !Character.isDigit(body.charAt(nameStart))) {
                    tokens.add(new ReferenceToken(i, nameEnd + 1, body.substring(nameStart, nameEnd), marked));
                    i = nameEnd + 1;
                    continue;
                }
            }
            i++;
        }
        return tokens;
    }

    private static boolean isIdentifierPart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }
}
