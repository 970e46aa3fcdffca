package camflow.core.events;

/**
 * Page navigation. Forces the camera back to the full canvas.
 */
public final class UrlEvent extends UserEvent {
    private final String url;

    public UrlEvent(long timestamp, String url) {
        super(timestamp);
        this.url = url;
    }

    @Override
    public EventType getType() {
        return EventType.URL;
    }

    @Override
    public UrlEvent withTimestamp(long newTimestamp) {
        return new UrlEvent(newTimestamp, url);
    }

    public String getUrl() {
        return url;
    }
}
