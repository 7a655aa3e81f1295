package com.samplesift.selection;

import com.samplesift.group.GroupKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToLongFunction;

/**
 * Routes grouped candidates into one {@link GroupQueue} per group, sized by the group's quota.
 * Force-included records never reach the selector, so quotas only bound the remainder.
 */
public final class PrioritySelector {

    private final ToLongFunction<GroupKey> quotas;
    private final PriorityProvider priorities;
    private final Map<GroupKey, GroupQueue> queues = new LinkedHashMap<>();

    public PrioritySelector(ToLongFunction<GroupKey> quotas, PriorityProvider priorities) {
        this.quotas = Objects.requireNonNull(quotas, "quotas");
        this.priorities = Objects.requireNonNull(priorities, "priorities");
    }

    /**
     * Ranks and offers one record.
     *
     * @return the candidate evicted by this offer, or {@code null}.
     */
    public Candidate offer(GroupKey key, String id, long ordinal) {
        GroupQueue queue = queues.computeIfAbsent(key, k -> new GroupQueue(quotas.applyAsLong(k)));
        return queue.offer(new Candidate(id, ordinal, priorities.priorityOf(id, ordinal)));
    }

    /** Groups seen so far, first-seen order. */
    public Map<GroupKey, GroupQueue> getQueues() {
        return queues;
    }

    /** Every selected candidate across groups, in no particular order. */
    public List<Candidate> selected() {
        List<Candidate> out = new ArrayList<>();
        for (GroupQueue queue : queues.values()) {
            out.addAll(queue.selected());
        }
        return out;
    }
}
