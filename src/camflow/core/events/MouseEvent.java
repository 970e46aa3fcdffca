package camflow.core.events;

import camflow.core.model.Point;

/**
 * A single cursor position sample.
 */
public final class MouseEvent extends UserEvent {
    private final Point position;

    public MouseEvent(long timestamp, Point position) {
        super(timestamp);
        this.position = position;
    }

    @Override
    public EventType getType() {
        return EventType.MOUSE;
    }

    @Override
    public MouseEvent withTimestamp(long newTimestamp) {
        return new MouseEvent(newTimestamp, position);
    }

    @Override
    public Point getPosition() {
        return position;
    }
}
