package camflow.core.events;

import camflow.core.model.Point;

/**
 * Synthetic event: the cursor rested around {@code position} from the timestamp until {@code endTime}.
 */
public final class HoverEvent extends UserEvent {
    private final Point position;
    private final long endTime;

    public HoverEvent(long timestamp, long endTime, Point position) {
        super(timestamp);
        this.endTime = endTime;
        this.position = position;
    }

    @Override
    public EventType getType() {
        return EventType.HOVER;
    }

    /** Moves the start and keeps the duration. */
    @Override
    public HoverEvent withTimestamp(long newTimestamp) {
        return new HoverEvent(newTimestamp, newTimestamp + getDurationMs(), position);
    }

    public HoverEvent withTimes(long newStart, long newEnd) {
        return new HoverEvent(newStart, newEnd, position);
    }

    @Override
    public Point getPosition() {
        return position;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getDurationMs() {
        return endTime - getTimestamp();
    }

    @Override
    public String toString() {
        return "HOVER@" + getTimestamp() + "-" + endTime + " " + position;
    }
}
