package com.standallocator.solver;

import com.standallocator.domain.AllocationResult;
import com.standallocator.domain.AllocationStatus;
import com.standallocator.domain.StandAllocationProblem;
import com.standallocator.domain.StandAssignment;
import com.standallocator.domain.Turn;
import com.standallocator.solver.engine.SolveStatus;
import com.standallocator.solver.engine.SolverAdapter;
import com.standallocator.solver.engine.SolverVerdict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs one allocation: builds variables, assembles constraints, solves and
 * reads the chosen stand of every turn back from the verdict.
 *
 * Stateless between calls. Each call takes a fresh adapter from the supplier,
 * so one allocator can serve concurrent runs when the supplier can.
 */
public class StandAllocator {

    private static final Logger log = LoggerFactory.getLogger(StandAllocator.class);

    private final Supplier<SolverAdapter> adapterSupplier;
    private final AssignmentVariableBuilder variableBuilder = new AssignmentVariableBuilder();
    private final CoreConstraintAssembler coreAssembler = new CoreConstraintAssembler();
    private final AdjacencyConstraintAssembler adjacencyAssembler = new AdjacencyConstraintAssembler();

    public StandAllocator(Supplier<SolverAdapter> adapterSupplier) {
        this.adapterSupplier = adapterSupplier;
    }

    /**
     * @throws com.standallocator.domain.ConfigurationException for malformed rules or windows;
     *         thrown before the solver runs, also when some turn has no feasible stand
     */
    public AllocationResult allocate(StandAllocationProblem problem) {
        log.info("Allocating {}", problem);
        SolverAdapter adapter = adapterSupplier.get();

        AssignmentVariables variables = variableBuilder.build(problem, adapter);
        coreAssembler.assemble(variables, adapter);
        List<ShadowInterval> shadows = adjacencyAssembler.assemble(problem.getAdjacencyRules(), variables, adapter);

        // Checked after assembly so malformed rules still surface
        List<Turn> unplaceable = variables.getUnplaceableTurns();
        if (!unplaceable.isEmpty()) {
            log.warn("{} turn(s) have no feasible stand: {}", unplaceable.size(),
                unplaceable.stream().map(Turn::getKey).toList());
            return AllocationResult.noFeasibleStand(unplaceable);
        }

        log.info("Model: {} candidates, {} shadow intervals, solving with {}",
            variables.getCandidates().size(), shadows.size(), adapter.getName());

        SolverVerdict verdict = adapter.solve();
        return interpret(verdict, variables);
    }

    private AllocationResult interpret(SolverVerdict verdict, AssignmentVariables variables) {
        switch (verdict.getStatus()) {
            case OPTIMAL:
            case FEASIBLE:
                break;
            case INFEASIBLE:
                log.info("No solution: the model is infeasible");
                return AllocationResult.noSolution(AllocationStatus.INFEASIBLE, verdict.getWallTimeMillis());
            default:
                log.warn("No solution found, solver verdict unknown");
                return AllocationResult.noSolution(AllocationStatus.UNKNOWN, verdict.getWallTimeMillis());
        }

        List<StandAssignment> assignments = new ArrayList<>();
        for (Turn turn : variables.getTurns()) {
            List<AssignmentCandidate> chosen = variables.getCandidatesFor(turn).stream()
                .filter(c -> verdict.isPresent(c.getPresence()))
                .toList();
            if (chosen.size() != 1) {
                throw new IllegalStateException("Solver returned " + chosen.size() + " stands for turn "
                    + turn.getKey() + ": " + chosen);
            }
            assignments.add(new StandAssignment(turn, chosen.get(0).getStand()));
        }

        AllocationStatus status = verdict.getStatus() == SolveStatus.OPTIMAL
            ? AllocationStatus.OPTIMAL : AllocationStatus.FEASIBLE;
        log.info("Solution found ({}), {} turns placed in {} ms", status, assignments.size(),
            verdict.getWallTimeMillis());
        return AllocationResult.solved(status, assignments, verdict.getWallTimeMillis());
    }
}
