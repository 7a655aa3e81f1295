package com.samplesift.outcome;

/** Raised under {@link EmptyOutputPolicy#ERROR} when no record was kept. */
public final class EmptyOutputException extends Exception {
    private final Outcome outcome;

    public EmptyOutputException(String message, Outcome outcome) {
        super(message);
        this.outcome = outcome;
    }

    /** The finalized summary, so a report can still be produced. */
    public Outcome getOutcome() {
        return outcome;
    }
}
