package com.standallocator.solver.engine.timefold;

import java.util.Set;

/**
 * Problem fact: exactly one of the member literals must be present.
 */
public class ExactlyOneGroup {

    private final int index;
    private final Set<Integer> literalIndices;

    public ExactlyOneGroup(int index, Set<Integer> literalIndices) {
        this.index = index;
        this.literalIndices = Set.copyOf(literalIndices);
    }

    public boolean contains(PresenceLiteral literal) {
        return literalIndices.contains(literal.getIndex());
    }

    public int getIndex() { return index; }
    public Set<Integer> getLiteralIndices() { return literalIndices; }

    @Override
    public String toString() {
        return "ExactlyOne#" + index + literalIndices;
    }
}
