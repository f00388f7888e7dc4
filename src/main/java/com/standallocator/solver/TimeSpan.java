package com.standallocator.solver;

/**
 * Closed-open time range [start, end) on the problem timeline, start &lt;= end.
 */
public final class TimeSpan {

    private final int start;
    private final int end;

    public TimeSpan(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("Span ends before it starts: [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public int getLength() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    // Share at least one instant; empty spans share none
    public boolean overlaps(TimeSpan other) {
        return start < other.end && other.start < end;
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSpan span = (TimeSpan) o;
        return start == span.start && end == span.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
