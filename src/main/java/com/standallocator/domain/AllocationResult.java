package com.standallocator.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of an allocation run.
 *
 * Assignments are present only when {@link AllocationStatus#hasSolution()} is
 * true and follow the problem's turn order. For
 * {@link AllocationStatus#NO_FEASIBLE_STAND} the turns that could not be
 * placed anywhere are listed.
 */
public final class AllocationResult {

    private final AllocationStatus status;
    private final List<StandAssignment> assignments;
    private final List<Turn> unplaceableTurns;
    private final long solveTimeMillis;

    private AllocationResult(AllocationStatus status, List<StandAssignment> assignments,
                             List<Turn> unplaceableTurns, long solveTimeMillis) {
        this.status = status;
        this.assignments = List.copyOf(assignments);
        this.unplaceableTurns = List.copyOf(unplaceableTurns);
        this.solveTimeMillis = solveTimeMillis;
    }

    public static AllocationResult solved(AllocationStatus status, List<StandAssignment> assignments,
                                          long solveTimeMillis) {
        if (!status.hasSolution()) {
            throw new IllegalArgumentException("Status " + status + " carries no assignments");
        }
        return new AllocationResult(status, assignments, List.of(), solveTimeMillis);
    }

    public static AllocationResult noSolution(AllocationStatus status, long solveTimeMillis) {
        if (status.hasSolution() || status == AllocationStatus.NO_FEASIBLE_STAND) {
            throw new IllegalArgumentException("Status " + status + " is not a solver no-solution verdict");
        }
        return new AllocationResult(status, List.of(), List.of(), solveTimeMillis);
    }

    public static AllocationResult noFeasibleStand(List<Turn> unplaceableTurns) {
        return new AllocationResult(AllocationStatus.NO_FEASIBLE_STAND, List.of(), unplaceableTurns, 0L);
    }

    public boolean hasSolution() {
        return status.hasSolution();
    }

    public Optional<Stand> getStandFor(Turn turn) {
        return assignments.stream()
            .filter(a -> a.getTurn().equals(turn))
            .map(StandAssignment::getStand)
            .findFirst();
    }

    // Stand id per turn key, in turn order
    public Map<String, String> asStandIdsByTurnKey() {
        Map<String, String> map = new LinkedHashMap<>();
        for (StandAssignment a : assignments) {
            map.put(a.getTurn().getKey(), a.getStand().getStandId());
        }
        return map;
    }

    // Getters
    public AllocationStatus getStatus() { return status; }
    public List<StandAssignment> getAssignments() { return assignments; }
    public List<Turn> getUnplaceableTurns() { return unplaceableTurns; }
    public long getSolveTimeMillis() { return solveTimeMillis; }

    @Override
    public String toString() {
        return "AllocationResult{" + status + ", " + assignments.size() + " assignments"
            + (unplaceableTurns.isEmpty() ? "" : ", unplaceable=" + unplaceableTurns) + "}";
    }
}
