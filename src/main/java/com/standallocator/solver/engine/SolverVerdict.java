package com.standallocator.solver.engine;

/**
 * Status of a solve plus, when a solution was found, the value of every presence variable.
 */
public final class SolverVerdict {

    private final SolveStatus status;
    private final boolean[] values;
    private final long wallTimeMillis;

    private SolverVerdict(SolveStatus status, boolean[] values, long wallTimeMillis) {
        this.status = status;
        this.values = values;
        this.wallTimeMillis = wallTimeMillis;
    }

    public static SolverVerdict solution(SolveStatus status, boolean[] values, long wallTimeMillis) {
        if (!status.hasSolution()) {
            throw new IllegalArgumentException("Status " + status + " has no variable values");
        }
        return new SolverVerdict(status, values.clone(), wallTimeMillis);
    }

    public static SolverVerdict noSolution(SolveStatus status, long wallTimeMillis) {
        if (status.hasSolution()) {
            throw new IllegalArgumentException("Status " + status + " requires variable values");
        }
        return new SolverVerdict(status, new boolean[0], wallTimeMillis);
    }

    /**
     * Value assigned to {@code var}.
     *
     * @throws IllegalStateException if the verdict carries no solution
     */
    public boolean isPresent(PresenceVar var) {
        if (!status.hasSolution()) {
            throw new IllegalStateException("No solution available, solver status is " + status);
        }
        return values[var.getIndex()];
    }

    public SolveStatus getStatus() { return status; }
    public long getWallTimeMillis() { return wallTimeMillis; }

    @Override
    public String toString() {
        return "SolverVerdict{" + status + " in " + wallTimeMillis + " ms}";
    }
}
