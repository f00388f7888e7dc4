package com.standallocator.solver;

import com.standallocator.domain.Stand;
import com.standallocator.domain.Turn;
import com.standallocator.solver.engine.OptionalInterval;
import com.standallocator.solver.engine.PresenceVar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variables created for one allocation run, with the two indexes the
 * constraint assemblers need:
 * - stand -> occupancy intervals of its candidates (no-overlap per stand)
 * - turn -> presence variables of its candidates (exactly one per turn)
 *
 * Every turn of the problem has an entry in the turn index, possibly empty.
 * Stands without candidates are absent from the stand index.
 */
public final class AssignmentVariables {

    private final List<Turn> turns;
    private final List<Stand> stands;
    private final List<AssignmentCandidate> candidates;
    private final Map<Turn, List<AssignmentCandidate>> candidatesByTurn;
    private final Map<Stand, List<AssignmentCandidate>> candidatesByStand;

    AssignmentVariables(List<Turn> turns, List<Stand> stands, List<AssignmentCandidate> candidates) {
        this.turns = List.copyOf(turns);
        this.stands = List.copyOf(stands);
        this.candidates = List.copyOf(candidates);

        Map<Turn, List<AssignmentCandidate>> byTurn = new LinkedHashMap<>();
        for (Turn turn : this.turns) {
            byTurn.put(turn, new ArrayList<>());
        }
        Map<Stand, List<AssignmentCandidate>> byStand = new LinkedHashMap<>();
        for (AssignmentCandidate candidate : this.candidates) {
            byTurn.get(candidate.getTurn()).add(candidate);
            byStand.computeIfAbsent(candidate.getStand(), k -> new ArrayList<>()).add(candidate);
        }
        byTurn.replaceAll((turn, list) -> Collections.unmodifiableList(list));
        byStand.replaceAll((stand, list) -> Collections.unmodifiableList(list));
        this.candidatesByTurn = Collections.unmodifiableMap(byTurn);
        this.candidatesByStand = Collections.unmodifiableMap(byStand);
    }

    public Map<Stand, List<OptionalInterval>> getIntervalsByStand() {
        Map<Stand, List<OptionalInterval>> index = new LinkedHashMap<>();
        candidatesByStand.forEach((stand, list) ->
            index.put(stand, list.stream().map(AssignmentCandidate::getOccupancy).toList()));
        return index;
    }

    public Map<Turn, List<PresenceVar>> getPresenceByTurn() {
        Map<Turn, List<PresenceVar>> index = new LinkedHashMap<>();
        candidatesByTurn.forEach((turn, list) ->
            index.put(turn, list.stream().map(AssignmentCandidate::getPresence).toList()));
        return index;
    }

    public List<AssignmentCandidate> getCandidatesFor(Turn turn) {
        return candidatesByTurn.getOrDefault(turn, List.of());
    }

    public List<AssignmentCandidate> getCandidatesOn(Stand stand) {
        return candidatesByStand.getOrDefault(stand, List.of());
    }

    public Optional<AssignmentCandidate> find(Turn turn, Stand stand) {
        return getCandidatesFor(turn).stream()
            .filter(c -> c.getStand().equals(stand))
            .findFirst();
    }

    /**
     * Turns with no feasible stand; their exactly-one constraint cannot be satisfied.
     */
    public List<Turn> getUnplaceableTurns() {
        return candidatesByTurn.entrySet().stream()
            .filter(e -> e.getValue().isEmpty())
            .map(Map.Entry::getKey)
            .toList();
    }

    public boolean hasStand(String standId) {
        return stands.stream().anyMatch(s -> s.getStandId().equals(standId));
    }

    // Getters
    public List<Turn> getTurns() { return turns; }
    public List<Stand> getStands() { return stands; }
    public List<AssignmentCandidate> getCandidates() { return candidates; }

    @Override
    public String toString() {
        return "AssignmentVariables{" + candidates.size() + " candidates for " + turns.size() + " turns on "
            + candidatesByStand.size() + "/" + stands.size() + " stands}";
    }
}
