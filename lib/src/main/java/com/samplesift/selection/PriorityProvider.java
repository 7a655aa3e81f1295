package com.samplesift.selection;

/** Supplies the ranking value of a record inside its group. Higher values are kept first. */
public interface PriorityProvider {

    /**
     * @param id record identifier
     * @param ordinal zero-based position of the record in the input stream
     */
    double priorityOf(String id, long ordinal);
}
