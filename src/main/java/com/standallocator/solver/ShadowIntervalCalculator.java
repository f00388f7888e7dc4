package com.standallocator.solver;

import com.standallocator.domain.ConfigurationException;
import com.standallocator.domain.TimeWindowDefinition;
import com.standallocator.domain.Turn;

/**
 * Derives the shadow window of a turn for one side of an adjacency rule.
 *
 * <pre>
 * start = (arrival | departure per startAnchor) + startOffsetMinutes
 * end   = (arrival | departure per endAnchor)   + endOffsetMinutes
 * </pre>
 *
 * Pure: the result depends only on the arguments. A window that resolves to
 * start &gt; end for the given turn is a configuration error; start == end
 * yields an empty span, which conflicts with nothing.
 */
public final class ShadowIntervalCalculator {

    private ShadowIntervalCalculator() {}

    public static TimeSpan compute(int arrivalTime, int departureTime, TimeWindowDefinition window) {
        int start = window.getStartAnchor().resolve(arrivalTime, departureTime) + window.getStartOffsetMinutes();
        int end = window.getEndAnchor().resolve(arrivalTime, departureTime) + window.getEndOffsetMinutes();
        if (start > end) {
            throw new ConfigurationException("Time window " + window + " resolves to [" + start + ", " + end
                + ") for occupancy [" + arrivalTime + ", " + departureTime + "), which ends before it starts");
        }
        return new TimeSpan(start, end);
    }

    public static TimeSpan compute(Turn turn, TimeWindowDefinition window) {
        try {
            return compute(turn.getArrivalTime(), turn.getDepartureTime(), window);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Turn " + turn.getKey() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Raw occupancy [arrival, departure) of a turn.
     */
    public static TimeSpan occupancy(Turn turn) {
        return new TimeSpan(turn.getArrivalTime(), turn.getDepartureTime());
    }
}
