package com.samplesift.allocation;

/**
 * Raised when no usable quota set can be produced for a target total: either every probabilistic
 * draw up to the attempt ceiling selected nothing, or probabilistic sampling was needed but
 * disabled.
 */
public final class AllocationExhaustedException extends Exception {
    private final int attempts;

    public AllocationExhaustedException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
