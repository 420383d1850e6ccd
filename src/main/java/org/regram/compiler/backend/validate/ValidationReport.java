package org.regram.compiler.backend.validate;

import org.regram.compiler.api.CaptureGroup;

import java.util.List;
import java.util.Objects;

/**
 * Result of validating a final pattern.
 *
 * @param captureCount  The number of capturing groups.
 * @param captureGroups The capturing groups in index order.
 */
public record ValidationReport(int captureCount, List<CaptureGroup> captureGroups) {

    public ValidationReport {
        captureGroups = List.copyOf(captureGroups);
    }

    /**
     * Gets the names of the named capturing groups in index order.
     * @return The capture names.
     */
    public List<String> captureNames() {
        return captureGroups.stream().map(CaptureGroup::name).filter(Objects::nonNull).toList();
    }
}
