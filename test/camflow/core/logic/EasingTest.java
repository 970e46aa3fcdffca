package camflow.core.logic;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class EasingTest {

    @Test
    void easeInOutIsQuadraticAndSymmetric() {
        Easing e = Easing.EASE_IN_OUT;
        assertEquals(0.0, e.apply(0), 1e-12);
        assertEquals(0.125, e.apply(0.25), 1e-12);
        assertEquals(0.5, e.apply(0.5), 1e-12);
        assertEquals(0.875, e.apply(0.75), 1e-12);
        assertEquals(1.0, e.apply(1), 1e-12);
    }

    @Test
    void inputIsClamped() {
        for (Easing e : Easing.values()) {
            assertEquals(0.0, e.apply(-3), 1e-12, e.name());
            assertEquals(1.0, e.apply(7), 1e-12, e.name());
        }
    }

    @Test
    void otherCurves() {
        assertEquals(0.25, Easing.EASE_IN.apply(0.5), 1e-12);
        assertEquals(0.75, Easing.EASE_OUT.apply(0.5), 1e-12);
        assertEquals(0.3, Easing.LINEAR.apply(0.3), 1e-12);
        assertEquals(15.0, Easing.lerp(10, 20, 0.5), 1e-12);
    }
}
