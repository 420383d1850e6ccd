package org.regram.compiler.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The final, engine-ready form of a macro for one dialect profile.
 *
 * @param name             The macro name.
 * @param profile          The profile the pattern was adapted to.
 * @param finalText        The regular expression text.
 * @param groupNameToIndex Maps each capture name to the 1-based index of its first capturing occurrence.
 *                         Lets callers of dialects without named captures find a group by position.
 * @param captureGroups    Every capturing group of {@code finalText}, in index order.
 */
public record CompiledPattern(
        String name,
        DialectProfile profile,
        String finalText,
        Map<String, Integer> groupNameToIndex,
        List<CaptureGroup> captureGroups
) {

    public CompiledPattern {
        groupNameToIndex = Collections.unmodifiableMap(new LinkedHashMap<>(groupNameToIndex));
        captureGroups = List.copyOf(captureGroups);
    }

    /**
     * Gets the number of capturing groups in the final text.
     * @return The capture group count.
     */
    public int groupCount() {
        return captureGroups.size();
    }
}
