package com.standallocator.domain;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated input of one allocation run: turns, stands, the feasibility
 * relation between them and the adjacency rules.
 *
 * Construction fails with {@link ConfigurationException} when
 * - two stands share an id, or two turns share (turnId, turnSeq)
 * - the feasibility matrix is not turns x stands
 * - an adjacency rule names a stand that is not in the stand list
 */
public final class StandAllocationProblem {

    private final List<Turn> turns;
    private final List<Stand> stands;
    private final FeasibilityMatrix feasibility;
    private final List<AdjacencyRule> adjacencyRules;

    // Lookup map (stand id -> column index)
    private final Map<String, Integer> standIndex;

    public StandAllocationProblem(List<Turn> turns, List<Stand> stands,
                                  FeasibilityMatrix feasibility, List<AdjacencyRule> adjacencyRules) {
        if (turns == null || stands == null || feasibility == null) {
            throw new ConfigurationException("Turns, stands and feasibility matrix are required");
        }
        this.turns = List.copyOf(turns);
        this.stands = List.copyOf(stands);
        this.feasibility = feasibility;
        this.adjacencyRules = adjacencyRules == null ? List.of() : List.copyOf(adjacencyRules);

        Map<String, Integer> index = new LinkedHashMap<>();
        for (int s = 0; s < this.stands.size(); s++) {
            String id = this.stands.get(s).getStandId();
            if (index.put(id, s) != null) {
                throw new ConfigurationException("Duplicate stand id: " + id);
            }
        }
        this.standIndex = Collections.unmodifiableMap(index);

        Set<Turn> seen = new HashSet<>();
        for (Turn turn : this.turns) {
            if (!seen.add(turn)) {
                throw new ConfigurationException("Duplicate turn: " + turn.getKey());
            }
        }

        if (feasibility.getTurnCount() != this.turns.size() || feasibility.getStandCount() != this.stands.size()) {
            throw new ConfigurationException("Feasibility matrix is " + feasibility.getTurnCount() + "x"
                + feasibility.getStandCount() + " but the problem has " + this.turns.size() + " turns and "
                + this.stands.size() + " stands");
        }

        Set<String> ruleIds = new HashSet<>();
        for (AdjacencyRule rule : this.adjacencyRules) {
            if (!ruleIds.add(rule.getRuleId())) {
                throw new ConfigurationException("Duplicate adjacency rule id: " + rule.getRuleId());
            }
            requireKnownStand(rule, rule.getStandA());
            requireKnownStand(rule, rule.getStandB());
        }
    }

    public static StandAllocationProblem of(List<Turn> turns, List<Stand> stands, List<AdjacencyRule> rules) {
        return new StandAllocationProblem(turns, stands,
            FeasibilityMatrix.allowAll(turns.size(), stands.size()), rules);
    }

    private void requireKnownStand(AdjacencyRule rule, String standId) {
        if (!standIndex.containsKey(standId)) {
            throw new ConfigurationException("Adjacency rule " + rule.getRuleId()
                + " references unknown stand " + standId);
        }
    }

    public boolean hasStand(String standId) {
        return standIndex.containsKey(standId);
    }

    public int indexOfStand(String standId) {
        Integer index = standIndex.get(standId);
        if (index == null) {
            throw new ConfigurationException("Unknown stand " + standId);
        }
        return index;
    }

    public boolean isFeasible(int turnIndex, int standIndex) {
        return feasibility.isFeasible(turnIndex, standIndex);
    }

    // Getters
    public List<Turn> getTurns() { return turns; }
    public List<Stand> getStands() { return stands; }
    public FeasibilityMatrix getFeasibility() { return feasibility; }
    public List<AdjacencyRule> getAdjacencyRules() { return adjacencyRules; }

    @Override
    public String toString() {
        return "StandAllocationProblem{" + turns.size() + " turns, " + stands.size() + " stands, "
            + adjacencyRules.size() + " adjacency rules}";
    }
}
