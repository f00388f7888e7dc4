package com.standallocator.solver.engine.timefold;

import ai.timefold.solver.core.api.solver.Solver;
import ai.timefold.solver.core.api.solver.SolverFactory;
import ai.timefold.solver.core.config.constructionheuristic.ConstructionHeuristicPhaseConfig;
import ai.timefold.solver.core.config.localsearch.LocalSearchPhaseConfig;
import ai.timefold.solver.core.config.localsearch.LocalSearchType;
import ai.timefold.solver.core.config.solver.SolverConfig;
import ai.timefold.solver.core.config.solver.termination.TerminationConfig;

import com.standallocator.solver.engine.AbstractSolverAdapter;
import com.standallocator.solver.engine.OptionalInterval;
import com.standallocator.solver.engine.PresenceVar;
import com.standallocator.solver.engine.SolveStatus;
import com.standallocator.solver.engine.SolverVerdict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Solver adapter backed by Timefold local search.
 *
 * Every presence variable becomes a {@link PresenceLiteral} planning entity with
 * a boolean planning variable; the constraint groups become hard constraints
 * (see {@link PresenceConstraintProvider}). Solving stops at the first feasible
 * score or when a time limit is reached.
 *
 * Local search cannot prove that no solution exists: a model it fails to
 * satisfy is reported UNKNOWN. INFEASIBLE is reported only for an empty
 * exactly-one group.
 */
public class TimefoldSolverAdapter extends AbstractSolverAdapter {

    private static final Logger log = LoggerFactory.getLogger(TimefoldSolverAdapter.class);

    private final long secondsSpentLimit;
    private final long unimprovedSecondsSpentLimit;

    public TimefoldSolverAdapter(long secondsSpentLimit, long unimprovedSecondsSpentLimit) {
        if (secondsSpentLimit <= 0 || unimprovedSecondsSpentLimit <= 0) {
            throw new IllegalArgumentException("Time limits must be positive: " + secondsSpentLimit
                + "s total, " + unimprovedSecondsSpentLimit + "s unimproved");
        }
        this.secondsSpentLimit = secondsSpentLimit;
        this.unimprovedSecondsSpentLimit = unimprovedSecondsSpentLimit;
    }

    @Override
    protected SolverVerdict doSolve() {
        for (List<PresenceVar> group : getExactlyOneGroups()) {
            if (group.isEmpty()) {
                log.info("Empty exactly-one group, model is infeasible without search");
                return SolverVerdict.noSolution(SolveStatus.INFEASIBLE, 0L);
            }
        }
        if (getPresenceVars().isEmpty()) {
            // Nothing to decide and no group to satisfy
            return SolverVerdict.solution(SolveStatus.OPTIMAL, new boolean[0], 0L);
        }

        PresenceModel problem = buildModel();

        SolverConfig solverConfig = new SolverConfig()
            .withSolutionClass(PresenceModel.class)
            .withEntityClasses(PresenceLiteral.class)
            .withConstraintProviderClass(PresenceConstraintProvider.class)
            .withPhases(
                new ConstructionHeuristicPhaseConfig(),
                new LocalSearchPhaseConfig()
                    .withLocalSearchType(LocalSearchType.LATE_ACCEPTANCE))
            .withTerminationConfig(
                new TerminationConfig()
                    .withBestScoreFeasible(true)
                    .withSecondsSpentLimit(secondsSpentLimit)
                    .withUnimprovedSecondsSpentLimit(unimprovedSecondsSpentLimit));

        Solver<PresenceModel> solver = SolverFactory.<PresenceModel>create(solverConfig).buildSolver();

        long startTime = System.currentTimeMillis();
        PresenceModel solution = solver.solve(problem);
        long wallTimeMillis = System.currentTimeMillis() - startTime;

        log.debug("Timefold best score {} after {} ms", solution.getScore(), wallTimeMillis);
        if (solution.getScore() == null || !solution.getScore().isFeasible()) {
            log.warn("Timefold found no feasible assignment (best score {}), verdict unknown",
                solution.getScore());
            return SolverVerdict.noSolution(SolveStatus.UNKNOWN, wallTimeMillis);
        }

        boolean[] values = new boolean[solution.getLiterals().size()];
        for (PresenceLiteral literal : solution.getLiterals()) {
            values[literal.getIndex()] = literal.isPresent();
        }
        return SolverVerdict.solution(SolveStatus.FEASIBLE, values, wallTimeMillis);
    }

    private PresenceModel buildModel() {
        List<PresenceLiteral> literals = new ArrayList<>();
        for (PresenceVar var : getPresenceVars()) {
            literals.add(new PresenceLiteral(var.getIndex(), var.getName()));
        }

        List<List<OptionalInterval>> noOverlapGroups = getNoOverlapGroups();
        for (int g = 0; g < noOverlapGroups.size(); g++) {
            for (OptionalInterval interval : noOverlapGroups.get(g)) {
                if (interval.getSize() == 0) {
                    continue; // empty intervals overlap nothing
                }
                literals.get(interval.getPresence().getIndex()).getSpans()
                    .add(new IntervalSpan(g, interval.getStart(), interval.getEnd()));
            }
        }

        List<ExactlyOneGroup> groups = new ArrayList<>();
        List<List<PresenceVar>> exactlyOneGroups = getExactlyOneGroups();
        for (int g = 0; g < exactlyOneGroups.size(); g++) {
            Set<Integer> members = new HashSet<>();
            for (PresenceVar var : exactlyOneGroups.get(g)) {
                members.add(var.getIndex());
            }
            groups.add(new ExactlyOneGroup(g, members));
        }

        return new PresenceModel(literals, groups);
    }

    @Override
    public String getName() {
        return "Timefold";
    }
}
