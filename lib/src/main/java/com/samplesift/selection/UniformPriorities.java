package com.samplesift.selection;

/**
 * Default priorities: a uniform double in {@code [0, 1)} derived from the run seed and the record
 * ordinal with the SplitMix64 finalizer. Stateless, so both passes and repeated runs agree.
 */
public final class UniformPriorities implements PriorityProvider {

    private final long seed;

    public UniformPriorities(long seed) {
        this.seed = seed;
    }

    @Override
    public double priorityOf(String id, long ordinal) {
        long mixed = mix64(ordinal ^ seed);
        return (mixed >>> 11) * 0x1.0p-53;
    }

    private static long mix64(long z) {
        z += 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
