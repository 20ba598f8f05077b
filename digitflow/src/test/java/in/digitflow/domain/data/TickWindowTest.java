package in.digitflow.domain.data;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TickWindow.
 *
 * Tests:
 * - Snapshot order is oldest first
 * - Capacity bound drops the oldest ticks
 * - Clear empties the window
 */
class TickWindowTest {

    private static Tick tick(int digit, long epoch) {
        return Tick.of("R_50", new BigDecimal("100.1" + digit), epoch);
    }

    @Test
    void testSnapshotOldestFirst() {
        TickWindow window = new TickWindow("R_50", 5);
        window.add(tick(1, 1));
        window.add(tick(2, 2));
        window.add(tick(3, 3));

        TickHistory history = window.snapshot();

        assertEquals(3, history.size());
        assertEquals(List.of(1, 2, 3), history.digits());
        assertEquals(3, history.latestTick().epoch());
    }

    @Test
    void testCapacityBound() {
        TickWindow window = new TickWindow("R_50", 4);
        for (int i = 0; i < 10; i++) {
            window.add(tick(i, i));
        }

        TickHistory history = window.snapshot();

        assertEquals(4, window.size(), "Window never grows beyond capacity");
        assertEquals(List.of(6, 7, 8, 9), history.digits(), "Oldest ticks are dropped");
        assertEquals(9, history.latestTick().epoch());
    }

    @Test
    void testDefaultCapacity() {
        TickWindow window = new TickWindow("R_50");
        for (int i = 0; i < 150; i++) {
            window.add(tick(i % 10, i));
        }

        assertEquals(TickWindow.DEFAULT_CAPACITY, window.capacity());
        assertEquals(TickWindow.DEFAULT_CAPACITY, window.snapshot().size());
    }

    @Test
    void testClear() {
        TickWindow window = new TickWindow("R_50", 3);
        window.add(tick(1, 1));
        window.clear();

        assertEquals(0, window.size());
        assertNull(window.snapshot().latestTick());
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new TickWindow("R_50", 0));
    }
}
