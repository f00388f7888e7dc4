package com.standallocator.solver;

import com.standallocator.domain.AdjacencyRule;
import com.standallocator.solver.engine.OptionalInterval;

/**
 * Shadow window of one candidate under one adjacency rule side, gated by the
 * candidate's presence variable.
 */
public final class ShadowInterval {

    /** Side of the rule the candidate's stand matched. */
    public enum Side { A, B }

    private final AdjacencyRule rule;
    private final Side side;
    private final AssignmentCandidate candidate;
    private final TimeSpan span;
    private final OptionalInterval interval;

    ShadowInterval(AdjacencyRule rule, Side side, AssignmentCandidate candidate,
                   TimeSpan span, OptionalInterval interval) {
        this.rule = rule;
        this.side = side;
        this.candidate = candidate;
        this.span = span;
        this.interval = interval;
    }

    // Getters
    public AdjacencyRule getRule() { return rule; }
    public Side getSide() { return side; }
    public AssignmentCandidate getCandidate() { return candidate; }
    public TimeSpan getSpan() { return span; }
    public OptionalInterval getInterval() { return interval; }

    @Override
    public String toString() {
        return interval.getName() + " " + span;
    }
}
