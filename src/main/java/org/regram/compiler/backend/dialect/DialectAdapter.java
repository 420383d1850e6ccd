package org.regram.compiler.backend.dialect;

import org.regram.compiler.api.AdaptOptions;
import org.regram.compiler.api.CaptureGroup;
import org.regram.compiler.api.DialectException;
import org.regram.compiler.api.DialectProfile;
import org.regram.compiler.api.DuplicateGroupNameException;
import org.regram.compiler.api.UnsupportedConstructException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites an expanded macro so that a target regex engine accepts it.
 * <p>
 * The adapter is a pure function of the expanded text, the {@link DialectProfile} and the
 * {@link AdaptOptions}. Rewrites only touch group headers and backreferences; everything else is
 * copied verbatim. Constructs the dialect cannot express and that have no faithful rewrite, such as a
 * variable-length lookbehind, are reported as {@link UnsupportedConstructException}.
 */
public class DialectAdapter {

    private static final Logger log = LoggerFactory.getLogger(DialectAdapter.class);

    private static final String NON_CAPTURING = "(?:";
    private static final String CAPTURING = "(";
    private static final int EXCERPT_LENGTH = 24;
    private static final int VARIABLE = -1;
    private static final int MAX_REPEAT_DIGITS = 9;

    /**
     * Adapts an expanded macro to a dialect.
     *
     * @param macroName The macro being adapted, used in error messages.
     * @param expanded  The dialect-agnostic expansion.
     * @param profile   The capabilities of the target engine.
     * @param options   Caller intent for rewrites the profile leaves open.
     * @return The adapted text and its capture groups.
     * @throws UnsupportedConstructException if the pattern is unbalanced or uses a construct the dialect lacks.
     * @throws DuplicateGroupNameException   if a group name repeats and the dialect forbids it.
     */
    public AdaptedPattern adapt(String macroName, String expanded, DialectProfile profile, AdaptOptions options)
            throws DialectException {
        PatternStructure structure;
        try {
            structure = PatternScanner.scan(expanded);
        } catch (MalformedPatternException e) {
            throw new UnsupportedConstructException(macroName, excerpt(expanded, e.getOffset()), e.getOffset(),
                    e.getReason());
        }

        if (!profile.variableLengthLookbehindSupport()) {
            checkLookbehinds(macroName, structure);
        }

        List<GroupPlan> plans = planGroups(macroName, structure, profile, options);
        boolean rejectDuplicates = !profile.duplicateNamedGroupsAllowed();
        if (rejectDuplicates && options.disambiguateDuplicateGroups()) {
            disambiguate(plans);
        }
        AdaptedPattern adapted = emit(macroName, structure, plans, profile);
        if (rejectDuplicates && !options.disambiguateDuplicateGroups()) {
            rejectDuplicates(macroName, adapted.captureGroups());
        }

        log.debug("Adapted macro '{}': {} capture groups, length {} -> {}",
                macroName, adapted.captureGroups().size(), expanded.length(), adapted.text().length());
        return adapted;
    }

    private void checkLookbehinds(String macroName, PatternStructure structure) throws UnsupportedConstructException {
        String text = structure.text();
        for (GroupToken group : structure.groups()) {
            if (group.kind() == GroupToken.Kind.LOOKBEHIND
                    && variableLengthOffset(text, group.headerEnd(), group.end()) >= 0) {
                throw new UnsupportedConstructException(macroName, text.substring(group.start(), group.end() + 1),
                        group.start(), "Variable-length lookbehind is not supported by the dialect");
            }
        }
    }

    /**
     * Looks for a quantifier that makes the text between {@code from} and {@code to} match a variable length.
     * Quantifiers inside character classes, escaped characters and group headers are not counted.
     *
     * @return The offset of the first such quantifier, or -1 if the text has a fixed length.
     */
    static int variableLengthOffset(String text, int from, int to) {
        int i = from;
        while (i < to) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> {
                    if (i + 1 < to && text.charAt(i + 1) == 'Q') {
                        int quoteEnd = text.indexOf("\\E", i + 2);
                        i = quoteEnd < 0 || quoteEnd >= to ? to : quoteEnd + 2;
                    } else {
                        i += 2;
                    }
                }
                case '[' -> {
                    int end = PatternScanner.classEnd(text, i);
                    i = end < 0 ? to : end;
                }
                case '(' -> {
                    char next = i + 1 < to ? text.charAt(i + 1) : 0;
                    if (next == '?' && i + 2 < to && text.charAt(i + 2) == '#') {
                        int commentEnd = text.indexOf(')', i + 3);
                        i = commentEnd < 0 ? to : commentEnd + 1;
                    } else {
                        i += (next == '?' || next == '*') ? 2 : 1;
                    }
                }
                case '*', '+', '?' -> {
                    return i;
                }
                case '{' -> {
                    int end = fixedQuantifierEnd(text, i, to);
                    if (end == VARIABLE) {
                        return i;
                    }
                    i = end;
                }
                default -> i++;
            }
        }
        return -1;
    }

    /**
     * Parses a brace quantifier.
     * @return {@link #VARIABLE} for {@code {m,}}, {@code {,n}}, {@code {m,n}} with m != n, or a count too large
     *         for any engine; otherwise the offset
     *         past the quantifier (and a lazy or possessive modifier), or past the brace if it is a literal.
     */
    private static int fixedQuantifierEnd(String text, int open, int to) {
        int j = open + 1;
        int minStart = j;
        while (j < to && Character.isDigit(text.charAt(j))) j++;
        String min = text.substring(minStart, j);
        String max = min;
        if (j < to && text.charAt(j) == ',') {
            int maxStart = ++j;
            while (j < to && Character.isDigit(text.charAt(j))) j++;
            max = text.substring(maxStart, j);
        }
        if (j >= to || text.charAt(j) != '}' || (min.isEmpty() && max.isEmpty())) {
            return open + 1;
        }
        if (min.isEmpty() || max.isEmpty() || min.length() > MAX_REPEAT_DIGITS || max.length() > MAX_REPEAT_DIGITS
                || Integer.parseInt(min) != Integer.parseInt(max)) {
            return VARIABLE;
        }
        j++;
        if (j < to && (text.charAt(j) == '?' || text.charAt(j) == '+')) j++;
        return j;
    }

    private List<GroupPlan> planGroups(String macroName, PatternStructure structure, DialectProfile profile,
                                       AdaptOptions options) throws UnsupportedConstructException {
        String text = structure.text();
        List<GroupPlan> plans = new ArrayList<>(structure.groups().size());
        int ordinal = 0;
        for (GroupToken group : structure.groups()) {
            GroupPlan plan = new GroupPlan(group, text.substring(group.start(), group.headerEnd()));
            if (group.captures()) {
                plan.originalOrdinal = ++ordinal;
            }
            switch (group.kind()) {
                case CAPTURING -> {
                    if (profile.explicitCaptureOnly()) {
                        plan.header = NON_CAPTURING;
                    } else {
                        plan.captures = true;
                    }
                }
                case NAMED -> {
                    if (profile.namedCaptureSupport()) {
                        plan.captures = true;
                        plan.name = group.name();
                    } else if (options.namedGroupsAsNonCapturing()) {
                        plan.header = NON_CAPTURING;
                    } else if (profile.explicitCaptureOnly()) {
                        throw new UnsupportedConstructException(macroName, plan.header, group.start(),
                                "Named group cannot capture in a dialect with explicit capture only "
                                        + "and no named captures");
                    } else {
                        plan.header = CAPTURING;
                        plan.captures = true;
                        plan.name = group.name();
                    }
                }
                default -> {
                }
            }
            plans.add(plan);
        }

        int index = 0;
        for (GroupPlan plan : plans) {
            if (plan.captures) {
                plan.index = ++index;
            }
        }
        return plans;
    }

    private void disambiguate(List<GroupPlan> plans) {
        Set<String> used = new HashSet<>();
        for (GroupPlan plan : plans) {
            if (plan.name != null) used.add(plan.name);
        }
        Set<String> seen = new HashSet<>();
        for (GroupPlan plan : plans) {
            if (plan.name == null || seen.add(plan.name)) {
                continue;
            }
            int suffix = 2;
            while (used.contains(plan.name + suffix)) suffix++;
            String renamed = plan.name + suffix;
            used.add(renamed);
            seen.add(renamed);
            plan.rename(renamed);
        }
    }

    private AdaptedPattern emit(String macroName, PatternStructure structure, List<GroupPlan> plans,
                                DialectProfile profile) throws UnsupportedConstructException {
        String text = structure.text();
        List<Edit> edits = new ArrayList<>();
        for (GroupPlan plan : plans) {
            edits.add(new Edit(plan.group.start(), plan.group.headerEnd(), plan.header, plan));
        }
        for (Backreference reference : structure.backreferences()) {
            String replacement = rewriteBackreference(macroName, text, reference, plans, profile);
            if (replacement != null) {
                edits.add(new Edit(reference.start(), reference.end(), replacement, null));
            }
        }
        edits.sort(Comparator.comparingInt(Edit::start));

        StringBuilder out = new StringBuilder(text.length());
        int position = 0;
        for (Edit edit : edits) {
            out.append(text, position, edit.start());
            if (edit.plan() != null) {
                edit.plan().offset = out.length();
            }
            out.append(edit.replacement());
            position = edit.end();
        }
        out.append(text, position, text.length());

        List<CaptureGroup> captureGroups = new ArrayList<>();
        Map<String, Integer> nameToIndex = new LinkedHashMap<>();
        for (GroupPlan plan : plans) {
            if (!plan.captures) continue;
            captureGroups.add(new CaptureGroup(plan.index, plan.name, plan.offset));
            if (plan.name != null) {
                nameToIndex.putIfAbsent(plan.name, plan.index);
            }
        }
        return new AdaptedPattern(out.toString(), nameToIndex, captureGroups);
    }

    /**
     * Computes the replacement text of a backreference whose target moved or lost its name.
     * @return The replacement, or null to keep the backreference as written.
     */
    private String rewriteBackreference(String macroName, String text, Backreference reference,
                                        List<GroupPlan> plans, DialectProfile profile)
            throws UnsupportedConstructException {
        GroupPlan target = null;
        if (reference.isNamed()) {
            if (profile.namedCaptureSupport()) {
                return null;
            }
            for (GroupPlan plan : plans) {
                if (reference.name().equals(plan.group.name())) {
                    target = plan;
                    break;
                }
            }
            if (target == null) {
                throw new UnsupportedConstructException(macroName, text.substring(reference.start(), reference.end()),
                        reference.start(), "Backreference to an unknown group name in a dialect without named captures");
            }
        } else {
            for (GroupPlan plan : plans) {
                if (plan.originalOrdinal == reference.number()) {
                    target = plan;
                    break;
                }
            }
            if (target == null || (target.captures && target.index == reference.number())) {
                return null;
            }
        }
        if (!target.captures) {
            throw new UnsupportedConstructException(macroName, text.substring(reference.start(), reference.end()),
                    reference.start(), "Backreference to a group that does not capture in the dialect");
        }
        String numbered = "\\" + target.index;
        if (reference.end() < text.length() && Character.isDigit(text.charAt(reference.end()))) {
            numbered = NON_CAPTURING + numbered + ")";
        }
        return numbered;
    }

    private void rejectDuplicates(String macroName, List<CaptureGroup> captureGroups)
            throws DuplicateGroupNameException {
        Map<String, List<Integer>> offsetsByName = new LinkedHashMap<>();
        for (CaptureGroup group : captureGroups) {
            if (group.isNamed()) {
                offsetsByName.computeIfAbsent(group.name(), k -> new ArrayList<>()).add(group.offset());
            }
        }
        for (Map.Entry<String, List<Integer>> entry : offsetsByName.entrySet()) {
            if (entry.getValue().size() > 1) {
                throw new DuplicateGroupNameException(macroName, entry.getKey(), entry.getValue());
            }
        }
    }

    private static String excerpt(String text, int offset) {
        return text.substring(offset, Math.min(text.length(), offset + EXCERPT_LENGTH));
    }

    private record Edit(int start, int end, String replacement, GroupPlan plan) {
    }

    /**
     * Adaptation decisions for one group, filled in while planning and emitting.
     */
    private static final class GroupPlan {
        private final GroupToken group;
        private String header;
        private boolean captures;
        private String name;
        private int originalOrdinal;
        private int index;
        private int offset;

        private GroupPlan(GroupToken group, String header) {
            this.group = group;
            this.header = header;
        }

        private void rename(String renamed) {
            if (group.namePrefix() != null && header.startsWith(group.namePrefix())) {
                header = group.namePrefix() + renamed + group.nameSuffix();
            }
            name = renamed;
        }
    }
}
