package camflow.core.events;

import camflow.core.model.Point;
import camflow.core.model.Rect;

/**
 * A scroll inside {@code targetRect} (source space), with the cursor at {@code position}.
 */
public final class ScrollEvent extends UserEvent {
    private final Point position;
    private final Rect targetRect;

    public ScrollEvent(long timestamp, Point position, Rect targetRect) {
        super(timestamp);
        this.position = position;
        this.targetRect = targetRect;
    }

    @Override
    public EventType getType() {
        return EventType.SCROLL;
    }

    @Override
    public ScrollEvent withTimestamp(long newTimestamp) {
        return new ScrollEvent(newTimestamp, position, targetRect);
    }

    @Override
    public Point getPosition() {
        return position;
    }

    public Rect getTargetRect() {
        return targetRect;
    }
}
