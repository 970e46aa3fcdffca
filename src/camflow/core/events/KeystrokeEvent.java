package camflow.core.events;

public final class KeystrokeEvent extends UserEvent {
    private final String key;
    private final String code;
    private final boolean ctrlKey;
    private final boolean metaKey;
    private final boolean shiftKey;
    private final boolean altKey;
    private final String tagName;

    public KeystrokeEvent(long timestamp, String key, String code,
                          boolean ctrlKey, boolean metaKey, boolean shiftKey, boolean altKey,
                          String tagName) {
        super(timestamp);
        this.key = key;
        this.code = code;
        this.ctrlKey = ctrlKey;
        this.metaKey = metaKey;
        this.shiftKey = shiftKey;
        this.altKey = altKey;
        this.tagName = tagName;
    }

    public KeystrokeEvent(long timestamp, String key) {
        this(timestamp, key, key, false, false, false, false, null);
    }

    @Override
    public EventType getType() {
        return EventType.KEY_DOWN;
    }

    @Override
    public KeystrokeEvent withTimestamp(long newTimestamp) {
        return new KeystrokeEvent(newTimestamp, key, code, ctrlKey, metaKey, shiftKey, altKey, tagName);
    }

    public String getKey() { return key; }
    public String getCode() { return code; }
    public boolean isCtrlKey() { return ctrlKey; }
    public boolean isMetaKey() { return metaKey; }
    public boolean isShiftKey() { return shiftKey; }
    public boolean isAltKey() { return altKey; }
    public String getTagName() { return tagName; }

    public boolean hasModifier() {
        return ctrlKey || metaKey || altKey;
    }
}
