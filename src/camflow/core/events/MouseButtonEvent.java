package camflow.core.events;

import camflow.core.model.Point;

/**
 * Press or release of the primary button. Carries {@link EventType#MOUSE_DOWN}
 * or {@link EventType#MOUSE_UP}.
 */
public final class MouseButtonEvent extends UserEvent {
    private final EventType type;
    private final Point position;

    public MouseButtonEvent(EventType type, long timestamp, Point position) {
        super(timestamp);
        if (type != EventType.MOUSE_DOWN && type != EventType.MOUSE_UP) {
            throw new IllegalArgumentException("Not a button event type: " + type);
        }
        this.type = type;
        this.position = position;
    }

    public static MouseButtonEvent down(long timestamp, Point position) {
        return new MouseButtonEvent(EventType.MOUSE_DOWN, timestamp, position);
    }

    public static MouseButtonEvent up(long timestamp, Point position) {
        return new MouseButtonEvent(EventType.MOUSE_UP, timestamp, position);
    }

    @Override
    public EventType getType() {
        return type;
    }

    @Override
    public MouseButtonEvent withTimestamp(long newTimestamp) {
        return new MouseButtonEvent(type, newTimestamp, position);
    }

    @Override
    public Point getPosition() {
        return position;
    }
}
