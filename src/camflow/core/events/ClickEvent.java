package camflow.core.events;

import camflow.core.model.Point;

public final class ClickEvent extends UserEvent {
    private final Point position;
    private final String tagName;

    public ClickEvent(long timestamp, Point position) {
        this(timestamp, position, null);
    }

    public ClickEvent(long timestamp, Point position, String tagName) {
        super(timestamp);
        this.position = position;
        this.tagName = tagName;
    }

    @Override
    public EventType getType() {
        return EventType.CLICK;
    }

    @Override
    public ClickEvent withTimestamp(long newTimestamp) {
        return new ClickEvent(newTimestamp, position, tagName);
    }

    @Override
    public Point getPosition() {
        return position;
    }

    public String getTagName() {
        return tagName;
    }
}
