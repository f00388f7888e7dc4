package com.standallocator.solver;

import com.standallocator.domain.Stand;
import com.standallocator.domain.Turn;
import com.standallocator.solver.engine.OptionalInterval;
import com.standallocator.solver.engine.PresenceVar;

/**
 * A feasible (turn, stand) pairing: a presence decision plus the occupancy
 * interval [arrival, departure) that exists only if the pairing is chosen.
 */
public final class AssignmentCandidate {

    private final Turn turn;
    private final int turnIndex;
    private final Stand stand;
    private final int standIndex;
    private final PresenceVar presence;
    private final OptionalInterval occupancy;

    AssignmentCandidate(Turn turn, int turnIndex, Stand stand, int standIndex,
                        PresenceVar presence, OptionalInterval occupancy) {
        this.turn = turn;
        this.turnIndex = turnIndex;
        this.stand = stand;
        this.standIndex = standIndex;
        this.presence = presence;
        this.occupancy = occupancy;
    }

    public boolean isOn(String standId) {
        return stand.getStandId().equals(standId);
    }

    // Getters
    public Turn getTurn() { return turn; }
    public int getTurnIndex() { return turnIndex; }
    public Stand getStand() { return stand; }
    public int getStandIndex() { return standIndex; }
    public PresenceVar getPresence() { return presence; }
    public OptionalInterval getOccupancy() { return occupancy; }

    @Override
    public String toString() {
        return "Candidate{" + turn.getKey() + " on " + stand.getStandId() + "}";
    }
}
