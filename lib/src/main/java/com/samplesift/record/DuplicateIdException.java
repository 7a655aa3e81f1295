package com.samplesift.record;

import java.util.List;
import java.util.Set;

/** Thrown when the input contains the same identifier on more than one row. */
public final class DuplicateIdException extends Exception {
    private final List<String> duplicateIds;

    /** @param duplicateIds offending identifiers; reported sorted. */
    public DuplicateIdException(Set<String> duplicateIds) {
        super("The following records are duplicated in the input:\n"
                + String.join("\n", duplicateIds.stream().sorted().toList()));
        this.duplicateIds = duplicateIds.stream().sorted().toList();
    }

    public List<String> getDuplicateIds() {
        return duplicateIds;
    }
}
