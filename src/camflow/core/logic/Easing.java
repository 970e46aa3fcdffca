package camflow.core.logic;

/**
 * Progress curves for camera transitions. Input and output are in [0, 1].
 */
public enum Easing {
    LINEAR,
    EASE_IN,
    EASE_OUT,
    EASE_IN_OUT;

    public double apply(double t) {
        if (t < 0) t = 0;
        if (t > 1) t = 1;

        switch (this) {
            case EASE_IN:
                return t * t;
            case EASE_OUT:
                return t * (2 - t);
            case EASE_IN_OUT:
                return t < 0.5 ? 2 * t * t : -1 + (4 - 2 * t) * t;
            case LINEAR:
            default:
                return t;
        }
    }

    public static double lerp(double from, double to, double t) {
        return from + (to - from) * t;
    }
}
