package camflow.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RectTest {

    @Test
    void containmentIncludesEdges() {
        Rect outer = new Rect(0, 0, 100, 100);
        assertTrue(outer.contains(new Rect(0, 0, 100, 100)));
        assertTrue(outer.contains(new Rect(10, 10, 20, 20)));
        assertFalse(outer.contains(new Rect(90, 90, 20, 20)));
        assertTrue(outer.contains(new Point(100, 0)));
        assertFalse(outer.contains(new Point(100.5, 0)));
    }

    @Test
    void intersection() {
        Rect a = new Rect(0, 0, 100, 100);
        assertEquals(new Rect(50, 50, 50, 50), a.intersect(new Rect(50, 50, 100, 100)));
        assertNull(a.intersect(new Rect(100, 0, 10, 10)));
        assertNull(a.intersect(new Rect(200, 200, 10, 10)));
    }

    @Test
    void centeredAndFull() {
        assertEquals(new Rect(40, 30, 20, 40), Rect.centeredOn(50, 50, 20, 40));
        assertEquals(new Rect(0, 0, 1920, 1080), Rect.full(new Size(1920, 1080)));
        assertEquals(new Point(50, 50), new Rect(40, 30, 20, 40).center());
    }

    @Test
    void tolerantComparisons() {
        Rect a = new Rect(0, 0, 500, 500);
        assertTrue(a.sameSize(new Rect(100, 100, 500.5, 499.5), 1.0));
        assertFalse(a.sameSize(new Rect(0, 0, 502, 500), 1.0));
        assertTrue(a.approximatelyEquals(new Rect(0.2, -0.2, 500, 500), 0.5));
        assertFalse(a.approximatelyEquals(new Rect(3, 0, 500, 500), 0.5));
    }
}
