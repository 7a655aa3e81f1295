package com.samplesift.predicate;

import java.util.Objects;

/** Outcome of one predicate (or of the whole pipeline) for one record. */
public final class Decision {

    public enum Verdict {
        /** Continue with the next predicate; at the end of the pipeline, the record passed. */
        PASS,
        /** Accept immediately and exempt the record from every later predicate and from quotas. */
        FORCE_INCLUDED,
        DROPPED
    }

    private static final Decision PASS = new Decision(Verdict.PASS, null, "");

    private final Verdict verdict;
    private final DropReason reason;
    private final String detail;

    private Decision(Verdict verdict, DropReason reason, String detail) {
        this.verdict = verdict;
        this.reason = reason;
        this.detail = detail;
    }

    public static Decision pass() {
        return PASS;
    }

    public static Decision forceInclude(String detail) {
        return new Decision(Verdict.FORCE_INCLUDED, null, Objects.requireNonNull(detail, "detail"));
    }

    public static Decision drop(DropReason reason, String detail) {
        return new Decision(Verdict.DROPPED, Objects.requireNonNull(reason, "reason"), detail == null ? "" : detail);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    /** The drop reason, or {@code null} unless the verdict is {@link Verdict#DROPPED}. */
    public DropReason getReason() {
        return reason;
    }

    /** Parameters of the deciding predicate, for the filter log (e.g. {@code min_date=2020-01-01}). */
    public String getDetail() {
        return detail;
    }

    public boolean isPass() {
        return verdict == Verdict.PASS;
    }

    public boolean isDropped() {
        return verdict == Verdict.DROPPED;
    }

    public boolean isForceIncluded() {
        return verdict == Verdict.FORCE_INCLUDED;
    }

    @Override
    public String toString() {
        return reason != null ? verdict + "(" + reason.getCode() + ")" : verdict.toString();
    }
}
