package com.samplesift.selection;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the {@code capacity} best candidates of one group. The heap root is the worst kept
 * candidate, so an offer costs {@code O(log capacity)} and memory never exceeds the quota.
 */
public final class GroupQueue {

    private final long capacity;
    private final PriorityQueue<Candidate> heap;

    public GroupQueue(long capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative");
        }
        this.capacity = capacity;
        this.heap = new PriorityQueue<>((int) Math.min(Math.max(capacity, 1), 64), Candidate.BEST_FIRST.reversed());
    }

    /**
     * Offers a candidate.
     *
     * @return the candidate that lost its place (possibly {@code candidate} itself), or
     *     {@code null} when everything offered so far still fits.
     */
    public Candidate offer(Candidate candidate) {
        if (capacity == 0) {
            return candidate;
        }
        if (heap.size() < capacity) {
            heap.add(candidate);
            return null;
        }
        Candidate worst = heap.peek();
        if (Candidate.BEST_FIRST.compare(candidate, worst) < 0) {
            heap.poll();
            heap.add(candidate);
            return worst;
        }
        return candidate;
    }

    public int size() {
        return heap.size();
    }

    public long getCapacity() {
        return capacity;
    }

    /** Kept candidates, best first. */
    public List<Candidate> selected() {
        List<Candidate> out = new ArrayList<>(heap);
        out.sort(Candidate.BEST_FIRST);
        return out;
    }
}
