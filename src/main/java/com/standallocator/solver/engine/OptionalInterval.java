package com.standallocator.solver.engine;

/**
 * Handle to a presence-gated interval [start, end) declared through a {@link SolverAdapter}.
 */
public final class OptionalInterval {

    private final int index;
    private final String name;
    private final long start;
    private final long end;
    private final PresenceVar presence;

    public OptionalInterval(int index, String name, long start, long end, PresenceVar presence) {
        this.index = index;
        this.name = name;
        this.start = start;
        this.end = end;
        this.presence = presence;
    }

    public long getSize() {
        return end - start;
    }

    // Closed-open: touching intervals and empty intervals never overlap
    public boolean overlaps(OptionalInterval other) {
        return start < other.end && other.start < end && getSize() > 0 && other.getSize() > 0;
    }

    // Getters
    public int getIndex() { return index; }
    public String getName() { return name; }
    public long getStart() { return start; }
    public long getEnd() { return end; }
    public PresenceVar getPresence() { return presence; }

    @Override
    public String toString() {
        return name + "[" + start + ", " + end + ") if " + presence.getName();
    }
}
