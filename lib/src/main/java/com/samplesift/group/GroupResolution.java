package com.samplesift.group;

import com.samplesift.predicate.DropReason;

/** Either a {@link GroupKey} or the grouping-ambiguity reason that prevented one. */
public final class GroupResolution {
    private final GroupKey key;
    private final DropReason reason;
    private final String detail;

    private GroupResolution(GroupKey key, DropReason reason, String detail) {
        this.key = key;
        this.reason = reason;
        this.detail = detail;
    }

    static GroupResolution grouped(GroupKey key) {
        return new GroupResolution(key, null, "");
    }

    static GroupResolution ambiguous(DropReason reason, String detail) {
        return new GroupResolution(null, reason, detail);
    }

    public boolean isGrouped() {
        return key != null;
    }

    public GroupKey getKey() {
        return key;
    }

    public DropReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }
}
