package com.standallocator.solver.engine.timefold;

/**
 * A non-empty interval [start, end) that takes part in one no-overlap group.
 */
public final class IntervalSpan {

    private final int groupIndex;
    private final long start;
    private final long end;

    public IntervalSpan(int groupIndex, long start, long end) {
        this.groupIndex = groupIndex;
        this.start = start;
        this.end = end;
    }

    public boolean conflictsWith(IntervalSpan other) {
        return groupIndex == other.groupIndex && start < other.end && other.start < end;
    }

    public int getGroupIndex() { return groupIndex; }
    public long getStart() { return start; }
    public long getEnd() { return end; }

    @Override
    public String toString() {
        return "g" + groupIndex + "[" + start + ", " + end + ")";
    }
}
