package com.standallocator.solver.engine;

/**
 * Handle to a boolean decision variable declared through a {@link SolverAdapter}.
 * The index is dense per adapter, starting at 0.
 */
public final class PresenceVar {

    private final int index;
    private final String name;

    public PresenceVar(int index, String name) {
        this.index = index;
        this.name = name;
    }

    public int getIndex() { return index; }
    public String getName() { return name; }

    @Override
    public String toString() {
        return name;
    }
}
