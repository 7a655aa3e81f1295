package com.samplesift.quality;

/** Per-sequence character counts, as recorded in a sequence index. */
public final class SequenceStats {
    private final long length;
    private final long validNucleotides;
    private final long ambiguousN;
    private final long invalidCharacters;

    public SequenceStats(long length, long validNucleotides, long ambiguousN, long invalidCharacters) {
        this.length = length;
        this.validNucleotides = validNucleotides;
        this.ambiguousN = ambiguousN;
        this.invalidCharacters = invalidCharacters;
    }

    public long getLength() {
        return length;
    }

    /** Count of A, C, G and T. */
    public long getValidNucleotides() {
        return validNucleotides;
    }

    public long getAmbiguousN() {
        return ambiguousN;
    }

    public long getInvalidCharacters() {
        return invalidCharacters;
    }
}
