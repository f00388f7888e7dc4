package com.standallocator.solver.engine;

import java.util.List;

/**
 * Minimal constraint-solver capability the allocation core is written against.
 *
 * An adapter instance holds a single model: variables and constraints are
 * declared first, then {@link #solve()} is called once. Implementations must
 * treat an optional interval as meaningful only when its presence variable
 * resolves true.
 */
public interface SolverAdapter {

    /**
     * Declares a boolean decision variable.
     */
    PresenceVar newPresenceVar(String name);

    /**
     * Declares a fixed interval [start, end) that exists only when {@code presence} is true.
     *
     * @throws IllegalArgumentException if {@code size != end - start}, the size is negative,
     *                                  or {@code presence} was not declared by this adapter
     */
    OptionalInterval newOptionalInterval(long start, long size, long end, PresenceVar presence, String name);

    /**
     * Exactly one of the given variables must be true. An empty list cannot be satisfied.
     */
    void addExactlyOne(List<PresenceVar> vars);

    /**
     * The present intervals among the given ones must not overlap pairwise.
     */
    void addNoOverlap(List<OptionalInterval> intervals);

    /**
     * Runs the search synchronously.
     *
     * @throws IllegalStateException if the model was already solved
     */
    SolverVerdict solve();

    /**
     * Short backend name for logs.
     */
    String getName();
}
