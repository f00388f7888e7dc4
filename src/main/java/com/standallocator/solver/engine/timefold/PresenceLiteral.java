package com.standallocator.solver.engine.timefold;

import ai.timefold.solver.core.api.domain.entity.PlanningEntity;
import ai.timefold.solver.core.api.domain.lookup.PlanningId;
import ai.timefold.solver.core.api.domain.variable.PlanningVariable;

import java.util.ArrayList;
import java.util.List;

/**
 * One boolean decision of the recorded model.
 *
 * The solver chooses {@code present}. The literal carries every interval it
 * gates, tagged with the no-overlap group the interval belongs to, so overlap
 * checks need only the two literals involved.
 */
@PlanningEntity
public class PresenceLiteral {

    @PlanningId
    private Integer index;

    private String name;

    // Intervals gated by this literal (FIXED)
    private List<IntervalSpan> spans = new ArrayList<>();

    @PlanningVariable(valueRangeProviderRefs = "presenceRange")
    private Boolean present;

    public PresenceLiteral() {}

    public PresenceLiteral(int index, String name) {
        this.index = index;
        this.name = name;
    }

    public boolean isPresent() {
        return Boolean.TRUE.equals(present);
    }

    public boolean overlapsWith(PresenceLiteral other) {
        return countOverlaps(other) > 0;
    }

    // Number of (this span, other span) pairs sharing a group and some instant
    public int countOverlaps(PresenceLiteral other) {
        int count = 0;
        for (IntervalSpan mine : spans) {
            for (IntervalSpan theirs : other.spans) {
                if (mine.conflictsWith(theirs)) {
                    count++;
                }
            }
        }
        return count;
    }

    // Two intervals of this literal in the same group that overlap each other
    public int countSelfOverlaps() {
        int count = 0;
        for (int i = 0; i < spans.size(); i++) {
            for (int j = i + 1; j < spans.size(); j++) {
                if (spans.get(i).conflictsWith(spans.get(j))) {
                    count++;
                }
            }
        }
        return count;
    }

    // Getters and Setters
    public Integer getIndex() { return index; }
    public void setIndex(Integer index) { this.index = index; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<IntervalSpan> getSpans() { return spans; }
    public void setSpans(List<IntervalSpan> spans) { this.spans = spans; }

    public Boolean getPresent() { return present; }
    public void setPresent(Boolean present) { this.present = present; }

    @Override
    public String toString() {
        return name + "=" + present;
    }
}
