package com.standallocator.domain;

/**
 * A turn placed on a stand in an accepted allocation.
 */
public final class StandAssignment {

    private final Turn turn;
    private final Stand stand;

    public StandAssignment(Turn turn, Stand stand) {
        this.turn = turn;
        this.stand = stand;
    }

    public Turn getTurn() { return turn; }
    public Stand getStand() { return stand; }

    @Override
    public String toString() {
        return "Turn " + turn.getKey() + " (Flight " + turn.getFlightId() + ") assigned to -> Stand "
            + stand.getStandId();
    }
}
