package camflow.core.model;

import camflow.core.events.EventType;

/**
 * A camera transition that arrives at {@code rect} at the output time matching
 * {@code sourceEndTimeMs}, having started {@code durationMs} earlier.
 * The end is stored in source time so the motion follows its moment through later cuts.
 */
public final class ViewportMotion {
    private final long sourceEndTimeMs;
    private final long durationMs;
    private final Rect rect;
    private final EventType reason; // null for the closing return to full view

    public ViewportMotion(long sourceEndTimeMs, long durationMs, Rect rect, EventType reason) {
        this.sourceEndTimeMs = sourceEndTimeMs;
        this.durationMs = durationMs;
        this.rect = rect;
        this.reason = reason;
    }

    public long getSourceEndTimeMs() {
        return sourceEndTimeMs;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Rect getRect() {
        return rect;
    }

    public EventType getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ViewportMotion)) return false;
        ViewportMotion other = (ViewportMotion) o;
        return sourceEndTimeMs == other.sourceEndTimeMs && durationMs == other.durationMs
            && rect.equals(other.rect) && reason == other.reason;
    }

    @Override
    public int hashCode() {
        int h = Long.hashCode(sourceEndTimeMs);
        h = 31 * h + Long.hashCode(durationMs);
        h = 31 * h + rect.hashCode();
        return 31 * h + (reason == null ? 0 : reason.hashCode());
    }

    @Override
    public String toString() {
        return "ViewportMotion[end=" + sourceEndTimeMs + ", dur=" + durationMs + ", " + rect
            + (reason != null ? ", " + reason : "") + "]";
    }
}
