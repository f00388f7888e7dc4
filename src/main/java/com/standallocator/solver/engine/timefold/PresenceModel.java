package com.standallocator.solver.engine.timefold;

import ai.timefold.solver.core.api.domain.solution.PlanningEntityCollectionProperty;
import ai.timefold.solver.core.api.domain.solution.PlanningScore;
import ai.timefold.solver.core.api.domain.solution.PlanningSolution;
import ai.timefold.solver.core.api.domain.solution.ProblemFactCollectionProperty;
import ai.timefold.solver.core.api.domain.valuerange.ValueRangeProvider;
import ai.timefold.solver.core.api.score.buildin.hardsoft.HardSoftScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Planning solution holding the recorded model: literals to decide and the
 * exactly-one groups over them. No-overlap groups live on the literals' spans.
 *
 * Only hard constraints exist, so a feasible score means a valid assignment.
 */
@PlanningSolution
public class PresenceModel {

    private static final List<Boolean> PRESENCE_RANGE = List.of(Boolean.FALSE, Boolean.TRUE);

    @ProblemFactCollectionProperty
    private List<ExactlyOneGroup> exactlyOneGroups = new ArrayList<>();

    @PlanningEntityCollectionProperty
    private List<PresenceLiteral> literals = new ArrayList<>();

    @PlanningScore
    private HardSoftScore score;

    public PresenceModel() {}

    public PresenceModel(List<PresenceLiteral> literals, List<ExactlyOneGroup> exactlyOneGroups) {
        this.literals = literals;
        this.exactlyOneGroups = exactlyOneGroups;
    }

    @ValueRangeProvider(id = "presenceRange")
    public List<Boolean> getPresenceRange() {
        return PRESENCE_RANGE;
    }

    // Getters and Setters
    public List<ExactlyOneGroup> getExactlyOneGroups() { return exactlyOneGroups; }
    public void setExactlyOneGroups(List<ExactlyOneGroup> exactlyOneGroups) { this.exactlyOneGroups = exactlyOneGroups; }

    public List<PresenceLiteral> getLiterals() { return literals; }
    public void setLiterals(List<PresenceLiteral> literals) { this.literals = literals; }

    public HardSoftScore getScore() { return score; }
    public void setScore(HardSoftScore score) { this.score = score; }
}
