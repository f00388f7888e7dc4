package com.standallocator.solver.engine.cpsat;

import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntervalVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;

import com.standallocator.solver.engine.AbstractSolverAdapter;
import com.standallocator.solver.engine.OptionalInterval;
import com.standallocator.solver.engine.PresenceVar;
import com.standallocator.solver.engine.SolveStatus;
import com.standallocator.solver.engine.SolverVerdict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Solver adapter backed by Google OR-Tools CP-SAT.
 *
 * Presence variables map to {@link BoolVar}s, optional intervals to optional
 * interval variables with constant bounds, and the two constraint families to
 * {@code addExactlyOne} / {@code addNoOverlap}. Empty intervals are left out
 * of no-overlap constraints, so they conflict with nothing. CP-SAT proves
 * infeasibility, so all four verdicts can occur.
 */
public class CpSatSolverAdapter extends AbstractSolverAdapter {

    private static final Logger log = LoggerFactory.getLogger(CpSatSolverAdapter.class);

    private static boolean nativeLoaded = false;

    private final double maxTimeInSeconds;
    private final int numWorkers;

    /**
     * @param maxTimeInSeconds wall-clock limit; UNKNOWN is reported when it is hit before a solution
     * @param numWorkers       parallel search workers, 0 keeps the CP-SAT default
     */
    public CpSatSolverAdapter(double maxTimeInSeconds, int numWorkers) {
        if (maxTimeInSeconds <= 0) {
            throw new IllegalArgumentException("Time limit must be positive: " + maxTimeInSeconds);
        }
        if (numWorkers < 0) {
            throw new IllegalArgumentException("Worker count must not be negative: " + numWorkers);
        }
        this.maxTimeInSeconds = maxTimeInSeconds;
        this.numWorkers = numWorkers;
    }

    private static synchronized void ensureNativeLoaded() {
        if (!nativeLoaded) {
            Loader.loadNativeLibraries();
            nativeLoaded = true;
        }
    }

    @Override
    protected SolverVerdict doSolve() {
        ensureNativeLoaded();

        CpModel model = new CpModel();

        List<BoolVar> bools = new ArrayList<>();
        for (PresenceVar var : getPresenceVars()) {
            bools.add(model.newBoolVar(var.getName()));
        }

        List<IntervalVar> intervalVars = new ArrayList<>();
        for (OptionalInterval interval : getIntervals()) {
            intervalVars.add(model.newOptionalIntervalVar(
                LinearExpr.constant(interval.getStart()),
                LinearExpr.constant(interval.getSize()),
                LinearExpr.constant(interval.getEnd()),
                bools.get(interval.getPresence().getIndex()),
                interval.getName()));
        }

        for (List<PresenceVar> group : getExactlyOneGroups()) {
            Literal[] literals = group.stream()
                .map(var -> bools.get(var.getIndex()))
                .toArray(Literal[]::new);
            model.addExactlyOne(literals);
        }

        for (List<OptionalInterval> group : getNoOverlapGroups()) {
            List<IntervalVar> members = new ArrayList<>();
            for (OptionalInterval interval : group) {
                // CP-SAT counts a zero-size interval inside another as overlapping
                if (interval.getSize() > 0) {
                    members.add(intervalVars.get(interval.getIndex()));
                }
            }
            if (members.size() > 1) {
                model.addNoOverlap(members);
            }
        }

        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(maxTimeInSeconds);
        if (numWorkers > 0) {
            solver.getParameters().setNumWorkers(numWorkers);
        }

        CpSolverStatus status = solver.solve(model);
        long wallTimeMillis = Math.round(solver.wallTime() * 1000);
        log.debug("CP-SAT status {} after {} ms ({} conflicts, {} branches)",
            status, wallTimeMillis, solver.numConflicts(), solver.numBranches());

        switch (status) {
            case OPTIMAL:
            case FEASIBLE:
                boolean[] values = new boolean[bools.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = solver.booleanValue(bools.get(i));
                }
                return SolverVerdict.solution(status == CpSolverStatus.OPTIMAL ? SolveStatus.OPTIMAL
                    : SolveStatus.FEASIBLE, values, wallTimeMillis);
            case INFEASIBLE:
                return SolverVerdict.noSolution(SolveStatus.INFEASIBLE, wallTimeMillis);
            case MODEL_INVALID:
                log.error("CP-SAT rejected the model: {}", model.validate());
                return SolverVerdict.noSolution(SolveStatus.UNKNOWN, wallTimeMillis);
            default:
                log.warn("CP-SAT stopped with status {} after {} ms", status, wallTimeMillis);
                return SolverVerdict.noSolution(SolveStatus.UNKNOWN, wallTimeMillis);
        }
    }

    @Override
    public String getName() {
        return "CP-SAT";
    }
}
