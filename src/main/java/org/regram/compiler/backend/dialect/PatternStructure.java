package org.regram.compiler.backend.dialect;

import java.util.List;

/**
 * The group structure of a pattern, as found by {@link PatternScanner}.
 *
 * @param text            The scanned text.
 * @param groups          All groups, ordered by opening offset.
 * @param backreferences  All backreferences outside character classes, in textual order.
 */
public record PatternStructure(String text, List<GroupToken> groups, List<Backreference> backreferences) {

    public PatternStructure {
        groups = List.copyOf(groups);
        backreferences = List.copyOf(backreferences);
    }

    /**
     * Gets the groups that capture, in numbering order.
     * @return The capturing groups.
     */
    public List<GroupToken> capturingGroups() {
        return groups.stream().filter(GroupToken::captures).toList();
    }
}
