package com.standallocator.solver;

import com.standallocator.domain.Stand;
import com.standallocator.domain.StandAllocationProblem;
import com.standallocator.domain.Turn;
import com.standallocator.solver.engine.OptionalInterval;
import com.standallocator.solver.engine.PresenceVar;
import com.standallocator.solver.engine.SolverAdapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares one presence variable and one optional occupancy interval per
 * feasible (turn, stand) pair.
 *
 * This is the only place infeasible pairs are pruned: no variable exists for
 * them, so no later constraint can select them.
 */
public class AssignmentVariableBuilder {

    private static final Logger log = LoggerFactory.getLogger(AssignmentVariableBuilder.class);

    public AssignmentVariables build(StandAllocationProblem problem, SolverAdapter adapter) {
        List<Turn> turns = problem.getTurns();
        List<Stand> stands = problem.getStands();
        List<AssignmentCandidate> candidates = new ArrayList<>();

        for (int t = 0; t < turns.size(); t++) {
            Turn turn = turns.get(t);
            for (int s = 0; s < stands.size(); s++) {
                if (!problem.isFeasible(t, s)) {
                    continue;
                }
                Stand stand = stands.get(s);
                PresenceVar isPresent = adapter.newPresenceVar(turn.getKey() + "_on_" + stand.getStandId());
                OptionalInterval occupancy = adapter.newOptionalInterval(
                    turn.getArrivalTime(),
                    turn.getGroundTime(),
                    turn.getDepartureTime(),
                    isPresent,
                    "stand_" + stand.getStandId() + "_for_" + turn.getKey());
                candidates.add(new AssignmentCandidate(turn, t, stand, s, isPresent, occupancy));
            }
        }

        AssignmentVariables variables = new AssignmentVariables(turns, stands, candidates);
        log.debug("Built {} ({} of {} pairs pruned as infeasible)", variables,
            (long) turns.size() * stands.size() - candidates.size(), (long) turns.size() * stands.size());
        return variables;
    }
}
