package com.standallocator.domain;

/**
 * Declared conflict between two physically close stands.
 *
 * No turn may occupy stand A's shadow window while another turn occupies
 * stand B's shadow window. The conflict is symmetric; the order of the two
 * sides only pairs each stand with its own time window.
 */
public final class AdjacencyRule {

    private final String ruleId;
    private final String name;
    private final String description; // optional
    private final String standA;
    private final String standB;
    private final TimeWindowDefinition timeConstraintA;
    private final TimeWindowDefinition timeConstraintB;

    public AdjacencyRule(String ruleId, String name, String description,
                         String standA, String standB,
                         TimeWindowDefinition timeConstraintA,
                         TimeWindowDefinition timeConstraintB) {
        if (ruleId == null || ruleId.isBlank()) {
            throw new ConfigurationException("Adjacency rule id must not be blank");
        }
        if (standA == null || standB == null) {
            throw new ConfigurationException("Adjacency rule " + ruleId + " must name two stands");
        }
        if (timeConstraintA == null || timeConstraintB == null) {
            throw new ConfigurationException("Adjacency rule " + ruleId + " must define a time window per side");
        }
        this.ruleId = ruleId;
        this.name = name != null && !name.isBlank() ? name : ruleId;
        this.description = description;
        this.standA = standA;
        this.standB = standB;
        this.timeConstraintA = timeConstraintA;
        this.timeConstraintB = timeConstraintB;
    }

    /**
     * Rule forbidding simultaneous raw occupancy of the two stands.
     */
    public static AdjacencyRule simultaneousOccupancy(String ruleId, String standA, String standB) {
        return new AdjacencyRule(ruleId, standA + "_" + standB + "_adjacency", null, standA, standB,
            TimeWindowDefinition.identity(), TimeWindowDefinition.identity());
    }

    public boolean involves(String standId) {
        return standA.equals(standId) || standB.equals(standId);
    }

    // Getters
    public String getRuleId() { return ruleId; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getStandA() { return standA; }
    public String getStandB() { return standB; }
    public TimeWindowDefinition getTimeConstraintA() { return timeConstraintA; }
    public TimeWindowDefinition getTimeConstraintB() { return timeConstraintB; }

    @Override
    public String toString() {
        return "AdjacencyRule{" + name + ": " + standA + " " + timeConstraintA
            + " <-> " + standB + " " + timeConstraintB + "}";
    }
}
