package com.standallocator.solver.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SolverVerdictTest {

    private final PresenceVar first = new PresenceVar(0, "first");
    private final PresenceVar second = new PresenceVar(1, "second");

    @Test
    public void testSolutionExposesValues() {
        boolean[] values = {true, false};
        SolverVerdict verdict = SolverVerdict.solution(SolveStatus.FEASIBLE, values, 42L);
        values[1] = true;

        assertTrue(verdict.isPresent(first));
        assertFalse(verdict.isPresent(second), "values are copied");
        assertEquals(42L, verdict.getWallTimeMillis());
    }

    @Test
    public void testStatusMustMatchFactory() {
        assertThrows(IllegalArgumentException.class,
            () -> SolverVerdict.solution(SolveStatus.INFEASIBLE, new boolean[0], 0L));
        assertThrows(IllegalArgumentException.class,
            () -> SolverVerdict.noSolution(SolveStatus.OPTIMAL, 0L));
    }

    @Test
    public void testNoSolutionHasNoValues() {
        SolverVerdict verdict = SolverVerdict.noSolution(SolveStatus.UNKNOWN, 5L);

        assertThrows(IllegalStateException.class, () -> verdict.isPresent(first));
    }

    @Test
    public void testIntervalOverlapIsClosedOpen() {
        OptionalInterval a = new OptionalInterval(0, "a", 10, 35, first);
        OptionalInterval touching = new OptionalInterval(1, "b", 35, 60, second);
        OptionalInterval inside = new OptionalInterval(2, "c", 20, 30, second);
        OptionalInterval empty = new OptionalInterval(3, "d", 20, 20, second);

        assertFalse(a.overlaps(touching));
        assertTrue(a.overlaps(inside));
        assertFalse(a.overlaps(empty));
        assertFalse(empty.overlaps(a));
    }
}
