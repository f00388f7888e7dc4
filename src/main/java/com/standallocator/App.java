package com.standallocator;

import com.standallocator.config.SolverSettings;
import com.standallocator.domain.AllocationResult;
import com.standallocator.domain.AdjacencyRule;
import com.standallocator.domain.StandAllocationProblem;
import com.standallocator.domain.StandAssignment;
import com.standallocator.domain.Turn;
import com.standallocator.persistence.ProblemFileRepository;
import com.standallocator.solver.StandAllocator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Command line entry point: loads a problem, allocates stands and logs the outcome.
 *
 * Usage: App [problem.json]. Without an argument the bundled sample problem is used.
 * Solver settings come from the environment, see {@link SolverSettings}.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final String SAMPLE_PROBLEM = "/sample-problem.json";

    public static void main(String[] args) {
        try {
            log.info("=== Stand Allocator Starting ===");

            SolverSettings settings = SolverSettings.fromEnvironment();
            log.info("Solver settings: {}", settings);

            ProblemFileRepository repository = new ProblemFileRepository();
            StandAllocationProblem problem = args.length >= 1
                ? repository.load(Path.of(args[0]))
                : repository.loadResource(SAMPLE_PROBLEM);

            log.info("Problem loaded:");
            log.info("  - {} turns", problem.getTurns().size());
            log.info("  - {} stands", problem.getStands().size());
            log.info("  - {} adjacency rules", problem.getAdjacencyRules().size());
            for (AdjacencyRule rule : problem.getAdjacencyRules()) {
                log.debug("    {}", rule);
            }

            StandAllocator allocator = new StandAllocator(settings.adapterSupplier());
            AllocationResult result = allocator.allocate(problem);

            log.info("=== Allocation Finished: {} ===", result.getStatus());
            switch (result.getStatus()) {
                case OPTIMAL:
                case FEASIBLE:
                    log.info("Solution Found!");
                    for (StandAssignment assignment : result.getAssignments()) {
                        log.info("  {}", assignment);
                    }
                    break;
                case INFEASIBLE:
                    log.info("No solution found. The model is infeasible.");
                    break;
                case NO_FEASIBLE_STAND:
                    log.info("No solution possible. Turns without any feasible stand:");
                    for (Turn turn : result.getUnplaceableTurns()) {
                        log.info("  {}", turn);
                    }
                    break;
                default:
                    log.info("No solution found within the solver limits (status {})", result.getStatus());
            }

            if (!result.hasSolution()) {
                System.exit(2);
            }
        } catch (Exception e) {
            log.error("Error running stand allocator", e);
            System.exit(1);
        }
    }
}
