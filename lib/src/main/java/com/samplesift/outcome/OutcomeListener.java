package com.samplesift.outcome;

import com.samplesift.predicate.DropReason;

/**
 * Receives per-record classification events as they happen, for example to write an audit log.
 * Each record produces at most one event.
 */
public interface OutcomeListener {

    OutcomeListener NONE = new OutcomeListener() {};

    default void onDropped(String id, DropReason reason, String detail) {}

    default void onForceIncluded(String id, String detail) {}
}
