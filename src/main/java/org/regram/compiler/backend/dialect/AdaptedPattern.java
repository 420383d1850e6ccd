package org.regram.compiler.backend.dialect;

import org.regram.compiler.api.CaptureGroup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link DialectAdapter}: the rewritten text and the capture groups it contains.
 *
 * @param text             The adapted pattern text.
 * @param groupNameToIndex Capture names mapped to the index of their first capturing occurrence.
 * @param captureGroups    The capturing groups of {@code text} in index order.
 */
public record AdaptedPattern(String text, Map<String, Integer> groupNameToIndex, List<CaptureGroup> captureGroups) {

    public AdaptedPattern {
        groupNameToIndex = Collections.unmodifiableMap(new LinkedHashMap<>(groupNameToIndex));
        captureGroups = List.copyOf(captureGroups);
    }
}
