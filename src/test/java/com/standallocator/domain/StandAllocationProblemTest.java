package com.standallocator.domain;

import com.standallocator.testutil.AllocationFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StandAllocationProblemTest {

    @Test
    public void testSampleProblemIsValid() {
        StandAllocationProblem problem = AllocationFixtures.scenarioB();
        assertEquals(4, problem.getTurns().size());
        assertEquals(5, problem.getStands().size());
        assertEquals(2, problem.getAdjacencyRules().size());
        assertEquals(2, problem.indexOfStand("2L"));
        assertFalse(problem.isFeasible(3, 4));
        assertTrue(problem.isFeasible(2, 0));
    }

    @Test
    public void testFeasibilityDimensionsMustMatch() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new StandAllocationProblem(AllocationFixtures.sampleTurns(), AllocationFixtures.sampleStands(),
                FeasibilityMatrix.allowAll(4, 4), List.of()));
        assertTrue(e.getMessage().contains("4x4"));
    }

    @Test
    public void testRuleWithUnknownStandIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> StandAllocationProblem.of(AllocationFixtures.sampleTurns(), AllocationFixtures.sampleStands(),
                List.of(AdjacencyRule.simultaneousOccupancy("9", "1L", "9Z"))));
        assertTrue(e.getMessage().contains("9Z"));
    }

    @Test
    public void testDuplicatesAreRejected() {
        List<Turn> turns = List.of(new Turn("1", 0, "FR13", 20, 55), new Turn("1", 0, "FR13", 60, 90));
        assertThrows(ConfigurationException.class,
            () -> StandAllocationProblem.of(turns, List.of(new Stand("1L")), List.of()));

        List<Stand> stands = List.of(new Stand("1L"), new Stand("1L"));
        assertThrows(ConfigurationException.class,
            () -> StandAllocationProblem.of(List.of(), stands, List.of()));

        assertThrows(ConfigurationException.class,
            () -> StandAllocationProblem.of(AllocationFixtures.sampleTurns(), AllocationFixtures.sampleStands(),
                List.of(AdjacencyRule.simultaneousOccupancy("1", "1L", "1C"),
                    AdjacencyRule.simultaneousOccupancy("1", "2L", "2C"))));
    }

    @Test
    public void testRepeatedTurnWithDifferentSequenceIsAllowed() {
        List<Turn> turns = List.of(new Turn("1", 0, "FR13", 20, 55), new Turn("1", 1, "FR13", 600, 655));
        StandAllocationProblem problem = StandAllocationProblem.of(turns, List.of(new Stand("1L")), List.of());
        assertEquals(2, problem.getTurns().size());
    }

    @Test
    public void testUnknownStandLookup() {
        StandAllocationProblem problem = AllocationFixtures.scenarioA();
        assertFalse(problem.hasStand("9Z"));
        assertThrows(ConfigurationException.class, () -> problem.indexOfStand("9Z"));
    }
}
