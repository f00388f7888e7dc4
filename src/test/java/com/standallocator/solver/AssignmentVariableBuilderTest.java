package com.standallocator.solver;

import com.standallocator.domain.FeasibilityMatrix;
import com.standallocator.domain.Stand;
import com.standallocator.domain.StandAllocationProblem;
import com.standallocator.domain.Turn;
import com.standallocator.solver.engine.OptionalInterval;
import com.standallocator.solver.engine.PresenceVar;
import com.standallocator.testutil.AllocationFixtures;
import com.standallocator.testutil.RecordingSolverAdapter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AssignmentVariableBuilderTest {

    private final AssignmentVariableBuilder builder = new AssignmentVariableBuilder();

    @Test
    public void testOneCandidatePerFeasiblePair() {
        StandAllocationProblem problem = AllocationFixtures.scenarioA();
        RecordingSolverAdapter adapter = new RecordingSolverAdapter();

        AssignmentVariables variables = builder.build(problem, adapter);

        // 4 x 5 pairs, 5 forbidden
        assertEquals(15, variables.getCandidates().size());
        assertEquals(15, adapter.presenceVars().size());
        assertEquals(15, adapter.intervals().size());

        for (int t = 0; t < problem.getTurns().size(); t++) {
            for (int s = 0; s < problem.getStands().size(); s++) {
                Turn turn = problem.getTurns().get(t);
                Stand stand = problem.getStands().get(s);
                assertEquals(problem.isFeasible(t, s), variables.find(turn, stand).isPresent(),
                    "candidate for " + turn.getKey() + " on " + stand.getStandId());
            }
        }
    }

    @Test
    public void testCandidateIntervalIsTurnOccupancy() {
        StandAllocationProblem problem = AllocationFixtures.scenarioA();
        AssignmentVariables variables = builder.build(problem, new RecordingSolverAdapter());

        Turn turn1 = problem.getTurns().get(0);
        AssignmentCandidate candidate = variables.find(turn1, new Stand("2L")).orElseThrow();
        OptionalInterval occupancy = candidate.getOccupancy();

        assertEquals(20, occupancy.getStart());
        assertEquals(55, occupancy.getEnd());
        assertEquals(35, occupancy.getSize());
        assertSame(candidate.getPresence(), occupancy.getPresence());
        assertEquals("1_on_2L", candidate.getPresence().getName());
        assertEquals("stand_2L_for_1", occupancy.getName());
        assertEquals(0, candidate.getTurnIndex());
        assertEquals(2, candidate.getStandIndex());
    }

    @Test
    public void testIndexesByStandAndByTurn() {
        StandAllocationProblem problem = AllocationFixtures.scenarioA();
        AssignmentVariables variables = builder.build(problem, new RecordingSolverAdapter());

        Map<Turn, List<PresenceVar>> byTurn = variables.getPresenceByTurn();
        assertEquals(4, byTurn.size());
        assertEquals(4, byTurn.get(problem.getTurns().get(0)).size());
        assertEquals(2, byTurn.get(problem.getTurns().get(3)).size());

        Map<Stand, List<OptionalInterval>> byStand = variables.getIntervalsByStand();
        assertEquals(5, byStand.size());
        // only turn 3 may use 1L
        assertEquals(1, byStand.get(new Stand("1L")).size());
        assertEquals(4, byStand.get(new Stand("1C")).size());
        assertEquals(3, byStand.get(new Stand("2R")).size());
    }

    @Test
    public void testTurnWithoutFeasibleStandIsReported() {
        List<Turn> turns = AllocationFixtures.sampleTurns();
        FeasibilityMatrix feasibility = FeasibilityMatrix.builder(4, 2)
            .forbid(1, 0)
            .forbid(1, 1)
            .build();
        StandAllocationProblem problem = new StandAllocationProblem(turns,
            List.of(new Stand("1L"), new Stand("1C")), feasibility, List.of());

        AssignmentVariables variables = builder.build(problem, new RecordingSolverAdapter());

        assertEquals(List.of(turns.get(1)), variables.getUnplaceableTurns());
        assertTrue(variables.getPresenceByTurn().get(turns.get(1)).isEmpty());
        assertTrue(variables.getCandidatesFor(turns.get(1)).isEmpty());
    }

    @Test
    public void testStandWithoutCandidatesIsNotIndexed() {
        StandAllocationProblem problem = new StandAllocationProblem(AllocationFixtures.sampleTurns(),
            List.of(new Stand("1L"), new Stand("9Z")),
            FeasibilityMatrix.builder(4, 2).forbid(0, 1).forbid(1, 1).forbid(2, 1).forbid(3, 1).build(),
            List.of());

        AssignmentVariables variables = builder.build(problem, new RecordingSolverAdapter());

        assertFalse(variables.getIntervalsByStand().containsKey(new Stand("9Z")));
        assertTrue(variables.getCandidatesOn(new Stand("9Z")).isEmpty());
        assertTrue(variables.hasStand("9Z"));
    }
}
