package com.standallocator.domain;

import java.util.Arrays;

/**
 * Pre-computed Turn x Stand relation: true means the turn may be placed on the stand.
 *
 * Rows follow the problem's turn order and columns its stand order. Every pair
 * is feasible unless explicitly forbidden. No row or column needs to contain a
 * feasible pair.
 */
public final class FeasibilityMatrix {

    private final boolean[][] feasible;
    private final int turnCount;
    private final int standCount;

    private FeasibilityMatrix(boolean[][] feasible, int turnCount, int standCount) {
        this.feasible = feasible;
        this.turnCount = turnCount;
        this.standCount = standCount;
    }

    public static FeasibilityMatrix allowAll(int turnCount, int standCount) {
        return builder(turnCount, standCount).build();
    }

    /**
     * Copies a rectangular boolean table, rows = turns.
     */
    public static FeasibilityMatrix of(boolean[][] table) {
        if (table == null) {
            throw new ConfigurationException("Feasibility table must not be null");
        }
        int standCount = table.length == 0 ? 0 : table[0].length;
        boolean[][] copy = new boolean[table.length][];
        for (int t = 0; t < table.length; t++) {
            if (table[t] == null || table[t].length != standCount) {
                throw new ConfigurationException("Feasibility table is not rectangular: row " + t
                    + " has " + (table[t] == null ? 0 : table[t].length) + " columns, expected " + standCount);
            }
            copy[t] = table[t].clone();
        }
        return new FeasibilityMatrix(copy, table.length, standCount);
    }

    public static Builder builder(int turnCount, int standCount) {
        return new Builder(turnCount, standCount);
    }

    public boolean isFeasible(int turnIndex, int standIndex) {
        return feasible[turnIndex][standIndex];
    }

    public int countFeasible(int turnIndex) {
        int count = 0;
        for (boolean f : feasible[turnIndex]) {
            if (f) count++;
        }
        return count;
    }

    public int getTurnCount() { return turnCount; }
    public int getStandCount() { return standCount; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FeasibilityMatrix{").append(turnCount).append('x').append(standCount);
        for (boolean[] row : feasible) {
            sb.append("\n  ");
            for (boolean f : row) {
                sb.append(f ? '1' : '.');
            }
        }
        return sb.append('}').toString();
    }

    public static final class Builder {

        private final boolean[][] feasible;
        private final int turnCount;
        private final int standCount;

        private Builder(int turnCount, int standCount) {
            if (turnCount < 0 || standCount < 0) {
                throw new ConfigurationException("Feasibility dimensions must not be negative: "
                    + turnCount + "x" + standCount);
            }
            this.turnCount = turnCount;
            this.standCount = standCount;
            this.feasible = new boolean[turnCount][standCount];
            for (boolean[] row : feasible) {
                Arrays.fill(row, true);
            }
        }

        public Builder forbid(int turnIndex, int standIndex) {
            checkBounds(turnIndex, standIndex);
            feasible[turnIndex][standIndex] = false;
            return this;
        }

        public Builder allow(int turnIndex, int standIndex) {
            checkBounds(turnIndex, standIndex);
            feasible[turnIndex][standIndex] = true;
            return this;
        }

        public FeasibilityMatrix build() {
            boolean[][] copy = new boolean[turnCount][];
            for (int t = 0; t < turnCount; t++) {
                copy[t] = feasible[t].clone();
            }
            return new FeasibilityMatrix(copy, turnCount, standCount);
        }

        private void checkBounds(int turnIndex, int standIndex) {
            if (turnIndex < 0 || turnIndex >= turnCount || standIndex < 0 || standIndex >= standCount) {
                throw new ConfigurationException("Feasibility cell (" + turnIndex + ", " + standIndex
                    + ") is outside a " + turnCount + "x" + standCount + " matrix");
            }
        }
    }
}
