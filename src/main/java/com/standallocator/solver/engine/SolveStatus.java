package com.standallocator.solver.engine;

/**
 * Verdict of a solve call, independent of the backend.
 */
public enum SolveStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    UNKNOWN;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
