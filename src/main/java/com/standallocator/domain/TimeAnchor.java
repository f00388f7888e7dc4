package com.standallocator.domain;

/**
 * Turn event a shadow window boundary is measured from.
 */
public enum TimeAnchor {
    ARRIVAL,
    DEPARTURE;

    public int resolve(int arrivalTime, int departureTime) {
        return this == ARRIVAL ? arrivalTime : departureTime;
    }
}
