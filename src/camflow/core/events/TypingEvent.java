package camflow.core.events;

import camflow.core.model.Point;
import camflow.core.model.Rect;

/**
 * A run of typing into the field described by {@code targetRect} (source space).
 * {@code position} is the caret or cursor position, when known.
 */
public final class TypingEvent extends UserEvent {
    private final Point position;
    private final Rect targetRect;

    public TypingEvent(long timestamp, Point position, Rect targetRect) {
        super(timestamp);
        this.position = position;
        this.targetRect = targetRect;
    }

    @Override
    public EventType getType() {
        return EventType.TYPING;
    }

    @Override
    public TypingEvent withTimestamp(long newTimestamp) {
        return new TypingEvent(newTimestamp, position, targetRect);
    }

    @Override
    public Point getPosition() {
        return position;
    }

    public Rect getTargetRect() {
        return targetRect;
    }
}
