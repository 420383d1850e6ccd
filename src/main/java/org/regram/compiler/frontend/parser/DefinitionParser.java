package org.regram.compiler.frontend.parser;

import org.regram.compiler.CompilerLimits;
import org.regram.compiler.api.DuplicateNameException;
import org.regram.compiler.api.GrammarException;
import org.regram.compiler.api.GrammarParseException;
import org.regram.compiler.api.InvalidIdentifierException;
import org.regram.compiler.api.ResourceLimitExceededException;
import org.regram.compiler.api.SourceInfo;
import org.regram.compiler.api.Visibility;
import org.regram.compiler.frontend.comments.SourceLine;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Second phase: turns each comment-free line into a {@link MacroDefinition}.
 * <p>
 * A definition has the shape {@code $(name)=body} for a public macro and {@code $(!name)=body} for an
 * internal one. The body is the rest of the line with surrounding whitespace removed.
 */
public class DefinitionParser {

    /** The visibility marker that makes a macro internal. */
    public static final char INTERNAL_MARKER = '!';

    /** Identifier syntax shared by definitions and references. */
    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern DEFINITION = Pattern.compile(
            "^\\$\\((" + Pattern.quote(String.valueOf(INTERNAL_MARKER)) + "?)([^()]*)\\)\\s*=(.*)$");

    private final String sourceName;
    private final CompilerLimits limits;

    public DefinitionParser(String sourceName, CompilerLimits limits) {
        this.sourceName = sourceName;
        this.limits = limits;
    }

    /**
     * Parses all lines into a macro table.
     *
     * @param lines The comment-free lines, in file order.
     * @return The table of definitions.
     * @throws GrammarException on the first malformed line, invalid name, duplicate name or exceeded limit.
     */
    public MacroTable parse(List<SourceLine> lines) throws GrammarException {
        MacroTable table = new MacroTable();
        long totalBodySize = 0;

        for (SourceLine line : lines) {
            SourceInfo location = new SourceInfo(sourceName, line.lineNumber());
            Matcher matcher = DEFINITION.matcher(line.text());
            if (!matcher.matches()) {
                throw new GrammarParseException("Expected a macro definition of the form $(name)=body, got: "
                        + line.text(), location);
            }

            Visibility visibility = matcher.group(1).isEmpty() ? Visibility.PUBLIC : Visibility.INTERNAL;
            String name = matcher.group(2);
            String body = matcher.group(3).strip();

            if (!IDENTIFIER.matcher(name).matches()) {
                throw new InvalidIdentifierException(name, location);
            }
            var existing = table.get(name);
            if (existing.isPresent()) {
                throw new DuplicateNameException(name, location, existing.get().sourceLine());
            }
            if (table.size() + 1 > limits.maxMacroCount()) {
                throw new ResourceLimitExceededException("max-macro-count", limits.maxMacroCount(),
                        table.size() + 1L, location, name);
            }
            totalBodySize += body.length();
            if (totalBodySize > limits.maxTotalBodySize()) {
                throw new ResourceLimitExceededException("max-total-body-size", limits.maxTotalBodySize(),
                        totalBodySize, location, name);
            }

            table.add(new MacroDefinition(table.size(), name, visibility, body, line.lineNumber()));
        }
        return table;
    }
}
