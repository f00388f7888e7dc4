package com.standallocator.testutil;

import com.standallocator.domain.AdjacencyRule;
import com.standallocator.domain.FeasibilityMatrix;
import com.standallocator.domain.Stand;
import com.standallocator.domain.StandAllocationProblem;
import com.standallocator.domain.Turn;

import java.util.List;

/**
 * Shared test problems built around the four-turn, five-stand demonstration instance.
 */
public final class AllocationFixtures {

    private AllocationFixtures() {}

    public static List<Turn> sampleTurns() {
        return List.of(
            new Turn("1", 0, "FR13", 20, 55),
            new Turn("2", 0, "FR42", 10, 35),
            new Turn("3", 0, "FR66", 35, 60),
            new Turn("4", 0, "FR99", 25, 50));
    }

    public static List<Stand> sampleStands() {
        return List.of(new Stand("1L"), new Stand("1C"), new Stand("2L"), new Stand("2C"), new Stand("2R"));
    }

    // All true except (1,1L) (2,1L) (4,1L) (4,2L) (4,2R)
    public static FeasibilityMatrix sampleFeasibility() {
        return FeasibilityMatrix.builder(4, 5)
            .forbid(0, 0)
            .forbid(1, 0)
            .forbid(3, 0)
            .forbid(3, 2)
            .forbid(3, 4)
            .build();
    }

    public static List<AdjacencyRule> sampleRules() {
        return List.of(
            AdjacencyRule.simultaneousOccupancy("1", "1L", "1C"),
            AdjacencyRule.simultaneousOccupancy("2", "2L", "2C"));
    }

    /**
     * Sample turns, stands and feasibility without adjacency rules.
     */
    public static StandAllocationProblem scenarioA() {
        return new StandAllocationProblem(sampleTurns(), sampleStands(), sampleFeasibility(), List.of());
    }

    /**
     * Scenario A plus the 1L-1C and 2L-2C identity adjacency rules.
     */
    public static StandAllocationProblem scenarioB() {
        return new StandAllocationProblem(sampleTurns(), sampleStands(), sampleFeasibility(), sampleRules());
    }

    /**
     * One stand, two turns with overlapping occupancy.
     */
    public static StandAllocationProblem scenarioC() {
        List<Turn> turns = List.of(new Turn("1", 0, "FR13", 20, 55), new Turn("2", 0, "FR42", 10, 35));
        return StandAllocationProblem.of(turns, List.of(new Stand("1C")), List.of());
    }
}
