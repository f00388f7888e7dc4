package com.standallocator.domain;

import java.util.Objects;

/**
 * A scheduled aircraft ground stay that needs a stand.
 *
 * Times are integer minutes on a timeline shared by all turns of a problem.
 * A turn is identified by (turnId, turnSeq); turnSeq disambiguates repeated
 * turns for the same flight.
 */
public final class Turn {

    // Joins turnId and turnSeq in keys, so it is not allowed in ids
    private static final char KEY_SEPARATOR = '#';

    private final String turnId;
    private final int turnSeq;
    private final String flightId;
    private final int arrivalTime;
    private final int departureTime;

    public Turn(String turnId, int turnSeq, String flightId, int arrivalTime, int departureTime) {
        if (turnId == null || turnId.isBlank()) {
            throw new ConfigurationException("Turn id must not be blank");
        }
        if (turnId.indexOf(KEY_SEPARATOR) >= 0) {
            throw new ConfigurationException("Turn id " + turnId + " must not contain '" + KEY_SEPARATOR + "'");
        }
        if (arrivalTime >= departureTime) {
            throw new ConfigurationException("Turn " + turnId + "/" + turnSeq
                + " must arrive before it departs (arrival=" + arrivalTime
                + ", departure=" + departureTime + ")");
        }
        this.turnId = turnId;
        this.turnSeq = turnSeq;
        this.flightId = flightId;
        this.arrivalTime = arrivalTime;
        this.departureTime = departureTime;
    }

    // Occupied minutes on the stand, departure excluded
    public int getGroundTime() {
        return departureTime - arrivalTime;
    }

    // Closed-open overlap: back-to-back turns do not conflict
    public boolean overlaps(Turn other) {
        return arrivalTime < other.departureTime && other.arrivalTime < departureTime;
    }

    // Label used in variable names and logs ("1", or "1#2" for a repeated turn)
    public String getKey() {
        return turnSeq == 0 ? turnId : turnId + KEY_SEPARATOR + turnSeq;
    }

    // Getters
    public String getTurnId() { return turnId; }
    public int getTurnSeq() { return turnSeq; }
    public String getFlightId() { return flightId; }
    public int getArrivalTime() { return arrivalTime; }
    public int getDepartureTime() { return departureTime; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Turn turn = (Turn) o;
        return turnSeq == turn.turnSeq && turnId.equals(turn.turnId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(turnId, turnSeq);
    }

    @Override
    public String toString() {
        return "Turn{" + getKey() + " " + flightId + " [" + arrivalTime + ", " + departureTime + ")}";
    }
}
