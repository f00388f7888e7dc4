package com.standallocator.domain;

import java.util.Objects;

/**
 * Rule for deriving a shadow interval from a turn's occupancy.
 *
 * Each boundary is an anchor (arrival or departure) plus a signed offset in
 * minutes. For example a "pushback" window covering the last 15 minutes before
 * departure is DEPARTURE-15 .. DEPARTURE+0.
 *
 * A definition whose anchors are equal and whose start offset exceeds its end
 * offset ends before it starts for every turn and is rejected here. Mixed
 * anchors can only be checked against a concrete turn, see
 * {@link com.standallocator.solver.ShadowIntervalCalculator}.
 */
public final class TimeWindowDefinition {

    private static final TimeWindowDefinition IDENTITY =
        new TimeWindowDefinition(TimeAnchor.ARRIVAL, 0, TimeAnchor.DEPARTURE, 0);

    private final TimeAnchor startAnchor;
    private final int startOffsetMinutes;
    private final TimeAnchor endAnchor;
    private final int endOffsetMinutes;

    public TimeWindowDefinition(TimeAnchor startAnchor, int startOffsetMinutes,
                                TimeAnchor endAnchor, int endOffsetMinutes) {
        if (startAnchor == null || endAnchor == null) {
            throw new ConfigurationException("Time window anchors must not be null");
        }
        if (startAnchor == endAnchor && startOffsetMinutes > endOffsetMinutes) {
            throw new ConfigurationException("Time window " + describe(startAnchor, startOffsetMinutes,
                endAnchor, endOffsetMinutes) + " ends before it starts");
        }
        this.startAnchor = startAnchor;
        this.startOffsetMinutes = startOffsetMinutes;
        this.endAnchor = endAnchor;
        this.endOffsetMinutes = endOffsetMinutes;
    }

    /**
     * Window equal to the raw occupancy [arrival, departure).
     */
    public static TimeWindowDefinition identity() {
        return IDENTITY;
    }

    public boolean isIdentity() {
        return equals(IDENTITY);
    }

    // Getters
    public TimeAnchor getStartAnchor() { return startAnchor; }
    public int getStartOffsetMinutes() { return startOffsetMinutes; }
    public TimeAnchor getEndAnchor() { return endAnchor; }
    public int getEndOffsetMinutes() { return endOffsetMinutes; }

    private static String describe(TimeAnchor startAnchor, int startOffset, TimeAnchor endAnchor, int endOffset) {
        return "[" + startAnchor + signed(startOffset) + ", " + endAnchor + signed(endOffset) + ")";
    }

    private static String signed(int offset) {
        return offset < 0 ? String.valueOf(offset) : "+" + offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeWindowDefinition that = (TimeWindowDefinition) o;
        return startOffsetMinutes == that.startOffsetMinutes
            && endOffsetMinutes == that.endOffsetMinutes
            && startAnchor == that.startAnchor
            && endAnchor == that.endAnchor;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startAnchor, startOffsetMinutes, endAnchor, endOffsetMinutes);
    }

    @Override
    public String toString() {
        return describe(startAnchor, startOffsetMinutes, endAnchor, endOffsetMinutes);
    }
}
