package camflow.core.events;

import camflow.core.model.Point;

/**
 * Base of every recorded (or synthesized) interaction. Immutable: time mapping
 * produces new instances through {@link #withTimestamp(long)}.
 */
public abstract class UserEvent {
    private final long timestamp;

    protected UserEvent(long timestamp) {
        this.timestamp = timestamp;
    }

    public abstract EventType getType();

    /** Copy of this event moved to another point on the same or another time axis. */
    public abstract UserEvent withTimestamp(long newTimestamp);

    public long getTimestamp() {
        return timestamp;
    }

    /** Cursor (or caret) position in source space, or {@code null} for non-positional events. */
    public Point getPosition() {
        return null;
    }

    @Override
    public String toString() {
        return getType() + "@" + timestamp;
    }
}
