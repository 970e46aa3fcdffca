package camflow.core.events;

/**
 * Tag of a recorded interaction. Consumers dispatch on this rather than probing fields.
 */
public enum EventType {
    CLICK,
    MOUSE,
    MOUSE_DOWN,
    MOUSE_UP,
    URL,
    KEY_DOWN,
    SCROLL,
    TYPING,
    HOVER;

    /** Events that break a hover: the cursor is no longer "just resting". */
    public boolean isHoverBoundary() {
        return this == CLICK || this == SCROLL || this == URL;
    }

    /** Events the camera scheduler reacts to. */
    public boolean isCameraRelevant() {
        switch (this) {
            case CLICK:
            case SCROLL:
            case TYPING:
            case URL:
            case HOVER:
                return true;
            default:
                return false;
        }
    }
}
