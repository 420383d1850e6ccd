package org.regram.compiler.api;

import java.util.List;

/**
 * A capture group name occurs more than once in a pattern whose dialect forbids duplicate names.
 */
public class DuplicateGroupNameException extends DialectException {

    private final String groupName;
    private final List<Integer> offsets;

    public DuplicateGroupNameException(String macroName, String groupName, List<Integer> offsets) {
        super(GrammarErrorCode.DUPLICATE_GROUP_NAME, macroName,
                "Capture group name '" + groupName + "' occurs " + offsets.size() + " times, at offsets " + offsets);
        this.groupName = groupName;
        this.offsets = List.copyOf(offsets);
    }

    /**
     * Gets the colliding group name.
     * @return The group name.
     */
    public String getGroupName() {
        return groupName;
    }

    /**
     * Gets the offsets of every occurrence of the group in the adapted text.
     * @return The occurrence offsets, in ascending order.
     */
    public List<Integer> getOffsets() {
        return offsets;
    }
}
