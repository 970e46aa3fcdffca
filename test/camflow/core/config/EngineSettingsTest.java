package camflow.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import camflow.core.logic.Easing;
import org.junit.jupiter.api.Test;

class EngineSettingsTest {

    @Test
    void defaults() {
        EngineSettings s = new EngineSettings();
        assertEquals(2.0, s.getMaxZoom());
        assertEquals(0.0, s.getPaddingFraction());
        assertEquals(500, s.getTransitionDurationMs());
        assertEquals(3000, s.getEndBufferMs());
        assertEquals(1.0, s.getSizeEpsilonPx());
        assertEquals(0.1, s.getHoverBoxFraction());
        assertEquals(1000, s.getHoverMinDurationMs());
        assertEquals(0.1, s.getTargetPaddingFraction());
        assertEquals(500, s.getClickEffectDurationMs());
        assertEquals(Easing.EASE_IN_OUT, s.getTransitionEasing());
    }

    @Test
    void invalidValuesAreRejected() {
        EngineSettings s = new EngineSettings();
        assertThrows(IllegalArgumentException.class, () -> s.setMaxZoom(1.0));
        assertThrows(IllegalArgumentException.class, () -> s.setMaxZoom(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> s.setPaddingFraction(0.5));
        assertThrows(IllegalArgumentException.class, () -> s.setPaddingFraction(-0.01));
        assertThrows(IllegalArgumentException.class, () -> s.setTransitionDurationMs(-1));
        assertThrows(IllegalArgumentException.class, () -> s.setHoverBoxFraction(0));
        assertThrows(IllegalArgumentException.class, () -> s.setSizeEpsilonPx(-1));
        assertThrows(NullPointerException.class, () -> s.setTransitionEasing(null));
        // Failed sets leave the old value
        assertEquals(2.0, s.getMaxZoom());
    }

    @Test
    void copyIsIndependent() {
        EngineSettings s = new EngineSettings();
        s.setMaxZoom(3.0);
        EngineSettings copy = s.copy();

        assertNotSame(s, copy);
        assertEquals(s, copy);
        assertEquals(s.hashCode(), copy.hashCode());

        copy.setEndBufferMs(0);
        assertNotEquals(s, copy);
        EngineSettings linear = s.copy();
        linear.setTransitionEasing(Easing.LINEAR);
        assertNotEquals(s, linear);
        assertEquals(3000, s.getEndBufferMs());
    }
}
