package org.regram.compiler.frontend.comments;

import org.regram.compiler.api.GrammarParseException;
import org.regram.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * First phase of grammar compilation: removes {@code //} line comments and {@code /* ... *}{@code /}
 * block comments and drops the lines left blank.
 * <p>
 * Macro bodies are regex fragments and may contain {@code //} or {@code /*} as literal text inside a
 * character class, so comment recognition is suspended while a {@code [} is open on the current line.
 * A backslash escapes the following character both inside and outside classes.
 */
public class CommentStripper {

    private final String sourceName;

    /**
     * @param sourceName The grammar name, used in error locations.
     */
    public CommentStripper(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Strips comments from a grammar text.
     *
     * @param text The raw grammar text.
     * @return The non-blank lines in order, with their original line numbers.
     * @throws GrammarParseException if a block comment is not terminated.
     */
    public List<SourceLine> strip(String text) throws GrammarParseException {
        String source = text.replace("\r\n", "\n").replace('\r', '\n');
        List<SourceLine> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int line = 1;
        boolean inClass = false;
        int classMembers = 0;
        boolean classNegated = false;

        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);

            if (c == '\n') {
                emit(lines, line, current);
                line++;
                inClass = false;
                i++;
                continue;
            }

            if (c == '\\' && i + 1 < n && source.charAt(i + 1) != '\n') {
                current.append(c).append(source.charAt(i + 1));
                if (inClass) classMembers++;
                i += 2;
                continue;
            }

            if (inClass) {
                current.append(c);
                if (c == ']' && classMembers > 0) {
                    inClass = false;
                } else if (c == '^' && classMembers == 0 && !classNegated) {
                    classNegated = true;
                } else {
                    classMembers++;
                }
                i++;
                continue;
            }

            if (c == '[') {
                inClass = true;
                classMembers = 0;
                classNegated = false;
                current.append(c);
                i++;
                continue;
            }

            if (c == '/' && i + 1 < n && source.charAt(i + 1) == '/') {
                int end = source.indexOf('\n', i);
                i = end < 0 ? n : end;
                continue;
            }

            if (c == '/' && i + 1 < n && source.charAt(i + 1) == '*') {
                int startLine = line;
                int close = source.indexOf("*/", i + 2);
                if (close < 0) {
                    throw new GrammarParseException("Unterminated block comment", new SourceInfo(sourceName, startLine));
                }
                for (int k = i + 2; k < close; k++) {
                    if (source.charAt(k) == '\n') {
                        emit(lines, line, current);
                        line++;
                    }
                }
                i = close + 2;
                continue;
            }

            current.append(c);
            i++;
        }
        emit(lines, line, current);
        return lines;
    }

    private static void emit(List<SourceLine> lines, int lineNumber, StringBuilder text) {
        String stripped = text.toString().strip();
        if (!stripped.isEmpty()) {
            lines.add(new SourceLine(lineNumber, stripped));
        }
        text.setLength(0);
    }
}
