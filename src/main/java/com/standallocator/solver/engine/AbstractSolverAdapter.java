package com.standallocator.solver.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records the declared model and checks it, leaving the search to subclasses.
 *
 * Backends translate the recorded variables and constraint groups into their
 * own model in {@link #doSolve()}.
 */
public abstract class AbstractSolverAdapter implements SolverAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractSolverAdapter.class);

    private final List<PresenceVar> presenceVars = new ArrayList<>();
    private final List<OptionalInterval> intervals = new ArrayList<>();
    private final List<List<PresenceVar>> exactlyOneGroups = new ArrayList<>();
    private final List<List<OptionalInterval>> noOverlapGroups = new ArrayList<>();
    private boolean solved;

    @Override
    public PresenceVar newPresenceVar(String name) {
        checkNotSolved();
        PresenceVar var = new PresenceVar(presenceVars.size(), name);
        presenceVars.add(var);
        return var;
    }

    @Override
    public OptionalInterval newOptionalInterval(long start, long size, long end, PresenceVar presence, String name) {
        checkNotSolved();
        if (size < 0) {
            throw new IllegalArgumentException("Interval " + name + " has negative size " + size);
        }
        if (start + size != end) {
            throw new IllegalArgumentException("Interval " + name + ": start " + start + " + size " + size
                + " != end " + end);
        }
        checkOwned(presence);
        OptionalInterval interval = new OptionalInterval(intervals.size(), name, start, end, presence);
        intervals.add(interval);
        return interval;
    }

    @Override
    public void addExactlyOne(List<PresenceVar> vars) {
        checkNotSolved();
        vars.forEach(this::checkOwned);
        exactlyOneGroups.add(List.copyOf(vars));
    }

    @Override
    public void addNoOverlap(List<OptionalInterval> group) {
        checkNotSolved();
        for (OptionalInterval interval : group) {
            if (interval.getIndex() >= intervals.size() || intervals.get(interval.getIndex()) != interval) {
                throw new IllegalArgumentException("Interval " + interval.getName()
                    + " was not declared by this " + getName() + " adapter");
            }
        }
        noOverlapGroups.add(List.copyOf(group));
    }

    @Override
    public final SolverVerdict solve() {
        checkNotSolved();
        solved = true;
        log.debug("{}: solving {} presence vars, {} intervals, {} exactly-one, {} no-overlap constraints",
            getName(), presenceVars.size(), intervals.size(), exactlyOneGroups.size(), noOverlapGroups.size());
        SolverVerdict verdict = doSolve();
        log.info("{} finished: {}", getName(), verdict);
        return verdict;
    }

    protected abstract SolverVerdict doSolve();

    private void checkOwned(PresenceVar var) {
        if (var == null || var.getIndex() >= presenceVars.size() || presenceVars.get(var.getIndex()) != var) {
            throw new IllegalArgumentException("Presence variable " + var + " was not declared by this "
                + getName() + " adapter");
        }
    }

    private void checkNotSolved() {
        if (solved) {
            throw new IllegalStateException(getName() + " adapter has already been solved");
        }
    }

    // Recorded model, read-only
    protected List<PresenceVar> getPresenceVars() { return Collections.unmodifiableList(presenceVars); }
    protected List<OptionalInterval> getIntervals() { return Collections.unmodifiableList(intervals); }
    protected List<List<PresenceVar>> getExactlyOneGroups() { return Collections.unmodifiableList(exactlyOneGroups); }
    protected List<List<OptionalInterval>> getNoOverlapGroups() { return Collections.unmodifiableList(noOverlapGroups); }
}
