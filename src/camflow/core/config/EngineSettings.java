package camflow.core.config;

import camflow.core.logic.Easing;
import java.util.Objects;

/**
 * Tunable parameters of the viewport motion engine.
 * Defaults match the behaviour the editor ships with; every value is validated on set.
 */
public class EngineSettings {
    private double maxZoom = 2.0;
    private double paddingFraction = 0.0;
    private long transitionDurationMs = 500;
    private long endBufferMs = 3000;
    private double sizeEpsilonPx = 1.0;
    private Easing transitionEasing = Easing.EASE_IN_OUT;

    // Hover detection
    private double hoverBoxFraction = 0.1;
    private long hoverMinDurationMs = 1000;

    // Scroll / typing targets
    private double targetPaddingFraction = 0.1;

    // Mouse effects
    private long clickEffectDurationMs = 500;

    public EngineSettings() {
    }

    public EngineSettings(EngineSettings other) {
        this.maxZoom = other.maxZoom;
        this.paddingFraction = other.paddingFraction;
        this.transitionDurationMs = other.transitionDurationMs;
        this.endBufferMs = other.endBufferMs;
        this.sizeEpsilonPx = other.sizeEpsilonPx;
        this.transitionEasing = other.transitionEasing;
        this.hoverBoxFraction = other.hoverBoxFraction;
        this.hoverMinDurationMs = other.hoverMinDurationMs;
        this.targetPaddingFraction = other.targetPaddingFraction;
        this.clickEffectDurationMs = other.clickEffectDurationMs;
    }

    public EngineSettings copy() {
        return new EngineSettings(this);
    }

    /** Deepest zoom-in allowed; the camera never gets narrower than output / maxZoom. */
    public double getMaxZoom() { return maxZoom; }
    public void setMaxZoom(double maxZoom) {
        if (!(maxZoom > 1.0) || Double.isInfinite(maxZoom)) {
            throw new IllegalArgumentException("maxZoom must be > 1: " + maxZoom);
        }
        this.maxZoom = maxZoom;
    }

    public double getPaddingFraction() { return paddingFraction; }
    public void setPaddingFraction(double paddingFraction) {
        if (!(paddingFraction >= 0 && paddingFraction < 0.5)) {
            throw new IllegalArgumentException("paddingFraction must be in [0, 0.5): " + paddingFraction);
        }
        this.paddingFraction = paddingFraction;
    }

    public long getTransitionDurationMs() { return transitionDurationMs; }
    public void setTransitionDurationMs(long ms) {
        requireNonNegative("transitionDurationMs", ms);
        this.transitionDurationMs = ms;
    }

    /** Tail of the output in which no new camera motion is started. */
    public long getEndBufferMs() { return endBufferMs; }
    public void setEndBufferMs(long ms) {
        requireNonNegative("endBufferMs", ms);
        this.endBufferMs = ms;
    }

    public double getSizeEpsilonPx() { return sizeEpsilonPx; }
    public void setSizeEpsilonPx(double px) {
        if (!(px >= 0)) {
            throw new IllegalArgumentException("sizeEpsilonPx must be >= 0: " + px);
        }
        this.sizeEpsilonPx = px;
    }

    /** Progress curve every camera transition follows. */
    public Easing getTransitionEasing() { return transitionEasing; }
    public void setTransitionEasing(Easing easing) {
        this.transitionEasing = Objects.requireNonNull(easing, "transitionEasing");
    }

    /** Hover box edge as a fraction of the larger source dimension. */
    public double getHoverBoxFraction() { return hoverBoxFraction; }
    public void setHoverBoxFraction(double fraction) {
        if (!(fraction > 0 && fraction <= 1)) {
            throw new IllegalArgumentException("hoverBoxFraction must be in (0, 1]: " + fraction);
        }
        this.hoverBoxFraction = fraction;
    }

    public long getHoverMinDurationMs() { return hoverMinDurationMs; }
    public void setHoverMinDurationMs(long ms) {
        requireNonNegative("hoverMinDurationMs", ms);
        this.hoverMinDurationMs = ms;
    }

    /** Total growth applied to scroll and typing targets (0.1 = 5% per side). */
    public double getTargetPaddingFraction() { return targetPaddingFraction; }
    public void setTargetPaddingFraction(double fraction) {
        if (!(fraction >= 0 && fraction <= 1)) {
            throw new IllegalArgumentException("targetPaddingFraction must be in [0, 1]: " + fraction);
        }
        this.targetPaddingFraction = fraction;
    }

    public long getClickEffectDurationMs() { return clickEffectDurationMs; }
    public void setClickEffectDurationMs(long ms) {
        requireNonNegative("clickEffectDurationMs", ms);
        this.clickEffectDurationMs = ms;
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0: " + value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EngineSettings)) return false;
        EngineSettings s = (EngineSettings) o;
        return Double.compare(maxZoom, s.maxZoom) == 0
            && Double.compare(paddingFraction, s.paddingFraction) == 0
            && transitionDurationMs == s.transitionDurationMs
            && endBufferMs == s.endBufferMs
            && Double.compare(sizeEpsilonPx, s.sizeEpsilonPx) == 0
            && transitionEasing == s.transitionEasing
            && Double.compare(hoverBoxFraction, s.hoverBoxFraction) == 0
            && hoverMinDurationMs == s.hoverMinDurationMs
            && Double.compare(targetPaddingFraction, s.targetPaddingFraction) == 0
            && clickEffectDurationMs == s.clickEffectDurationMs;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(maxZoom);
        h = 31 * h + Double.hashCode(paddingFraction);
        h = 31 * h + Long.hashCode(transitionDurationMs);
        h = 31 * h + Long.hashCode(endBufferMs);
        h = 31 * h + Double.hashCode(sizeEpsilonPx);
        h = 31 * h + transitionEasing.hashCode();
        h = 31 * h + Double.hashCode(hoverBoxFraction);
        h = 31 * h + Long.hashCode(hoverMinDurationMs);
        h = 31 * h + Double.hashCode(targetPaddingFraction);
        return 31 * h + Long.hashCode(clickEffectDurationMs);
    }
}
