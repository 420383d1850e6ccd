package org.regram.compiler.backend.validate;

import org.regram.compiler.api.CaptureGroup;
import org.regram.compiler.api.DialectProfile;
import org.regram.compiler.api.InternalExpansionInvariantError;
import org.regram.compiler.backend.dialect.AdaptedPattern;
import org.regram.compiler.backend.dialect.GroupToken;
import org.regram.compiler.backend.dialect.MalformedPatternException;
import org.regram.compiler.backend.dialect.PatternScanner;
import org.regram.compiler.backend.dialect.PatternStructure;

import java.util.List;
import java.util.Objects;

/**
 * Final consistency check of an adapted pattern.
 * <p>
 * Every failure here means an earlier phase is broken, never that the grammar is wrong, so all
 * violations are reported as {@link InternalExpansionInvariantError}.
 */
public class Validator {

    /**
     * Validates an adapted pattern.
     *
     * @param macroName The macro the pattern was built from.
     * @param adapted   The adapter output.
     * @param profile   The profile the pattern was adapted to.
     * @return The capture group report.
     * @throws InternalExpansionInvariantError if the text is unbalanced or its groups disagree with the
     *                                         adapter's account.
     */
    public ValidationReport validate(String macroName, AdaptedPattern adapted, DialectProfile profile) {
        String text = adapted.text();
        PatternStructure structure;
        try {
            structure = PatternScanner.scan(text);
        } catch (MalformedPatternException e) {
            throw new InternalExpansionInvariantError("Macro '" + macroName + "' is unbalanced after adaptation: "
                    + e.getMessage());
        }

        List<GroupToken> capturing = structure.capturingGroups();
        if (capturing.size() != adapted.captureGroups().size()) {
            throw new InternalExpansionInvariantError(String.format(
                    "Macro '%s' has %d capturing groups but adaptation reported %d",
                    macroName, capturing.size(), adapted.captureGroups().size()));
        }
        for (int i = 0; i < capturing.size(); i++) {
            GroupToken found = capturing.get(i);
            CaptureGroup reported = adapted.captureGroups().get(i);
            if (found.start() != reported.offset() || reported.index() != i + 1) {
                throw new InternalExpansionInvariantError(String.format(
                        "Macro '%s': capturing group %d found at offset %d but reported at offset %d",
                        macroName, i + 1, found.start(), reported.offset()));
            }
            if (profile.namedCaptureSupport() && !Objects.equals(found.name(), reported.name())) {
                throw new InternalExpansionInvariantError(String.format(
                        "Macro '%s': capturing group %d is named '%s' but reported as '%s'",
                        macroName, i + 1, found.name(), reported.name()));
            }
        }
        return new ValidationReport(capturing.size(), adapted.captureGroups());
    }
}
