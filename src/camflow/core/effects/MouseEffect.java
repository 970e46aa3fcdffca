package camflow.core.effects;

import camflow.core.model.Point;

/**
 * One click ripple or drag indicator active at a queried time.
 * {@code position} is in source space; painters project it with the view mapper.
 */
public final class MouseEffect {

    public enum Kind {
        CLICK, DRAG
    }

    private final Kind kind;
    private final Point position;
    private final double progress;

    public MouseEffect(Kind kind, Point position, double progress) {
        this.kind = kind;
        this.position = position;
        this.progress = progress;
    }

    public Kind getKind() {
        return kind;
    }

    public Point getPosition() {
        return position;
    }

    /** 0 when the effect starts, 1 when it ends. */
    public double getProgress() {
        return progress;
    }

    @Override
    public String toString() {
        return kind + " " + position + " @" + progress;
    }
}
