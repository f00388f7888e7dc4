package com.standallocator.domain;

/**
 * Outcome of an allocation run.
 */
public enum AllocationStatus {
    /** Solver proved the returned allocation optimal. */
    OPTIMAL,
    /** Solver found a valid allocation. */
    FEASIBLE,
    /** Solver proved that no valid allocation exists. */
    INFEASIBLE,
    /** Solver stopped without an allocation and without a proof, e.g. on a time limit. */
    UNKNOWN,
    /** At least one turn has no feasible stand; the solver was not run. */
    NO_FEASIBLE_STAND;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
