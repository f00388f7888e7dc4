package com.standallocator.solver;

import com.standallocator.domain.ConfigurationException;
import com.standallocator.domain.TimeAnchor;
import com.standallocator.domain.TimeWindowDefinition;
import com.standallocator.domain.Turn;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shadow window derivation.
 * Covers:
 * 1. Anchor/offset combinations
 * 2. Determinism across call order
 * 3. Windows ending before they start (rejected) and empty windows (accepted)
 */
public class ShadowIntervalCalculatorTest {

    private final Turn turn = new Turn("1", 0, "FR13", 20, 55);

    @Test
    public void testIdentityWindowEqualsOccupancy() {
        TimeSpan span = ShadowIntervalCalculator.compute(turn, TimeWindowDefinition.identity());
        assertEquals(ShadowIntervalCalculator.occupancy(turn), span);
        assertEquals(new TimeSpan(20, 55), span);
    }

    @Test
    public void testAnchorsAndOffsets() {
        // pushback: last 15 minutes before departure
        assertEquals(new TimeSpan(40, 55), ShadowIntervalCalculator.compute(turn,
            new TimeWindowDefinition(TimeAnchor.DEPARTURE, -15, TimeAnchor.DEPARTURE, 0)));
        // arrival taxi-in: 10 minutes around arrival
        assertEquals(new TimeSpan(15, 25), ShadowIntervalCalculator.compute(turn,
            new TimeWindowDefinition(TimeAnchor.ARRIVAL, -5, TimeAnchor.ARRIVAL, 5)));
        // widened occupancy
        assertEquals(new TimeSpan(10, 65), ShadowIntervalCalculator.compute(turn,
            new TimeWindowDefinition(TimeAnchor.ARRIVAL, -10, TimeAnchor.DEPARTURE, 10)));
        // mixed anchors in reverse order still valid for this turn
        assertEquals(new TimeSpan(55, 60), ShadowIntervalCalculator.compute(turn,
            new TimeWindowDefinition(TimeAnchor.DEPARTURE, 0, TimeAnchor.ARRIVAL, 40)));
    }

    @Test
    public void testDerivationIsPure() {
        TimeWindowDefinition window = new TimeWindowDefinition(TimeAnchor.DEPARTURE, -20, TimeAnchor.DEPARTURE, 5);
        TimeSpan first = ShadowIntervalCalculator.compute(20, 55, window);
        ShadowIntervalCalculator.compute(10, 35, window);
        ShadowIntervalCalculator.compute(100, 400, TimeWindowDefinition.identity());
        TimeSpan again = ShadowIntervalCalculator.compute(20, 55, window);
        assertEquals(first, again);
        assertEquals(new TimeSpan(35, 60), again);
    }

    @Test
    public void testWindowEndingBeforeStartIsConfigurationError() {
        // Valid for long turns, not for a 35 minute one: departure + 0 > arrival + 30
        TimeWindowDefinition window = new TimeWindowDefinition(TimeAnchor.DEPARTURE, 0, TimeAnchor.ARRIVAL, 30);
        assertEquals(new TimeSpan(25, 30), ShadowIntervalCalculator.compute(new Turn("2", 0, "FR42", 0, 25), window));

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> ShadowIntervalCalculator.compute(turn, window));
        assertTrue(e.getMessage().contains("Turn 1"), e.getMessage());
        assertTrue(e.getMessage().contains("[55, 50)"), e.getMessage());
    }

    @Test
    public void testEmptyWindowIsAccepted() {
        TimeWindowDefinition window = new TimeWindowDefinition(TimeAnchor.DEPARTURE, 0, TimeAnchor.ARRIVAL, 35);
        TimeSpan span = ShadowIntervalCalculator.compute(turn, window);
        assertTrue(span.isEmpty());
        assertFalse(span.overlaps(new TimeSpan(0, 100)));
    }
}
