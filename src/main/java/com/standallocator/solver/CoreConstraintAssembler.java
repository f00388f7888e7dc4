package com.standallocator.solver;

import com.standallocator.domain.Stand;
import com.standallocator.domain.Turn;
import com.standallocator.solver.engine.OptionalInterval;
import com.standallocator.solver.engine.PresenceVar;
import com.standallocator.solver.engine.SolverAdapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Emits the two structural constraint families:
 * - every turn on exactly one of its candidate stands
 * - no two present occupancy intervals overlapping on the same stand
 *
 * A turn without candidates still gets its (empty) exactly-one constraint, so
 * the model is infeasible rather than silently dropping the turn.
 */
public class CoreConstraintAssembler {

    private static final Logger log = LoggerFactory.getLogger(CoreConstraintAssembler.class);

    /**
     * @return number of constraints added
     */
    public int assemble(AssignmentVariables variables, SolverAdapter adapter) {
        int exactlyOne = 0;
        for (Map.Entry<Turn, List<PresenceVar>> entry : variables.getPresenceByTurn().entrySet()) {
            if (entry.getValue().isEmpty()) {
                log.warn("Turn {} has no feasible stand, model is infeasible", entry.getKey().getKey());
            }
            adapter.addExactlyOne(entry.getValue());
            exactlyOne++;
        }

        int noOverlap = 0;
        for (Map.Entry<Stand, List<OptionalInterval>> entry : variables.getIntervalsByStand().entrySet()) {
            adapter.addNoOverlap(entry.getValue());
            noOverlap++;
        }

        log.debug("Added {} exactly-one and {} stand no-overlap constraints", exactlyOne, noOverlap);
        return exactlyOne + noOverlap;
    }
}
