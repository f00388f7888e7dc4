package com.standallocator.testutil;

import com.standallocator.domain.AdjacencyRule;
import com.standallocator.domain.AllocationResult;
import com.standallocator.domain.Stand;
import com.standallocator.domain.StandAllocationProblem;
import com.standallocator.domain.StandAssignment;
import com.standallocator.domain.Turn;
import com.standallocator.solver.ShadowIntervalCalculator;
import com.standallocator.solver.TimeSpan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks a returned allocation against the problem it solves, independently of any solver.
 */
public final class AllocationAssertions {

    private AllocationAssertions() {}

    public static void assertValidAllocation(StandAllocationProblem problem, AllocationResult result) {
        assertTrue(result.hasSolution(), "expected a solution but got " + result.getStatus());
        List<StandAssignment> assignments = result.getAssignments();
        assertEquals(problem.getTurns().size(), assignments.size(), "every turn placed once");

        for (int t = 0; t < problem.getTurns().size(); t++) {
            Turn turn = problem.getTurns().get(t);
            Stand stand = result.getStandFor(turn).orElseThrow(() -> new AssertionError("turn not placed"));
            assertTrue(problem.isFeasible(t, problem.indexOfStand(stand.getStandId())),
                turn.getKey() + " placed on forbidden stand " + stand.getStandId());
        }

        for (int i = 0; i < assignments.size(); i++) {
            for (int j = i + 1; j < assignments.size(); j++) {
                StandAssignment a = assignments.get(i);
                StandAssignment b = assignments.get(j);
                if (a.getStand().equals(b.getStand())) {
                    assertFalse(a.getTurn().overlaps(b.getTurn()),
                        a + " overlaps " + b + " on the same stand");
                }
                for (AdjacencyRule rule : problem.getAdjacencyRules()) {
                    TimeSpan shadowA = shadow(rule, a);
                    TimeSpan shadowB = shadow(rule, b);
                    if (shadowA != null && shadowB != null) {
                        assertFalse(shadowA.overlaps(shadowB),
                            a + " and " + b + " violate adjacency rule " + rule.getName());
                    }
                }
            }
        }
    }

    private static TimeSpan shadow(AdjacencyRule rule, StandAssignment assignment) {
        String standId = assignment.getStand().getStandId();
        if (standId.equals(rule.getStandA())) {
            return ShadowIntervalCalculator.compute(assignment.getTurn(), rule.getTimeConstraintA());
        }
        if (standId.equals(rule.getStandB())) {
            return ShadowIntervalCalculator.compute(assignment.getTurn(), rule.getTimeConstraintB());
        }
        return null;
    }
}
