package com.standallocator.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TimeWindowDefinitionTest {

    @Test
    public void testSameAnchorWindowEndingBeforeStartIsRejected() {
        assertThrows(ConfigurationException.class,
            () -> new TimeWindowDefinition(TimeAnchor.DEPARTURE, 10, TimeAnchor.DEPARTURE, 0));
        assertThrows(ConfigurationException.class,
            () -> new TimeWindowDefinition(TimeAnchor.ARRIVAL, 1, TimeAnchor.ARRIVAL, -1));
    }

    @Test
    public void testMixedAnchorsAreAcceptedAtDefinitionTime() {
        // Can only be judged against a concrete turn
        TimeWindowDefinition window = new TimeWindowDefinition(TimeAnchor.DEPARTURE, 0, TimeAnchor.ARRIVAL, 30);
        assertEquals(TimeAnchor.DEPARTURE, window.getStartAnchor());
        assertEquals(30, window.getEndOffsetMinutes());
    }

    @Test
    public void testZeroLengthSameAnchorWindowIsAllowed() {
        TimeWindowDefinition window = new TimeWindowDefinition(TimeAnchor.DEPARTURE, -5, TimeAnchor.DEPARTURE, -5);
        assertFalse(window.isIdentity());
    }

    @Test
    public void testNullAnchorIsRejected() {
        assertThrows(ConfigurationException.class,
            () -> new TimeWindowDefinition(null, 0, TimeAnchor.DEPARTURE, 0));
    }

    @Test
    public void testIdentity() {
        TimeWindowDefinition identity = TimeWindowDefinition.identity();
        assertTrue(identity.isIdentity());
        assertEquals(new TimeWindowDefinition(TimeAnchor.ARRIVAL, 0, TimeAnchor.DEPARTURE, 0), identity);
        assertEquals("[ARRIVAL+0, DEPARTURE+0)", identity.toString());
        assertEquals("[DEPARTURE-15, DEPARTURE+0)",
            new TimeWindowDefinition(TimeAnchor.DEPARTURE, -15, TimeAnchor.DEPARTURE, 0).toString());
    }

    @Test
    public void testAnchorResolution() {
        assertEquals(20, TimeAnchor.ARRIVAL.resolve(20, 55));
        assertEquals(55, TimeAnchor.DEPARTURE.resolve(20, 55));
    }
}
