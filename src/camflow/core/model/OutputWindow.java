package camflow.core.model;

/**
 * A slice [startMs, endMs) of timeline time that survives into the final cut.
 * Windows of one timeline are expected sorted by start and non-overlapping.
 */
public final class OutputWindow {
    private final String id;
    private final long startMs;
    private final long endMs;

    public OutputWindow(String id, long startMs, long endMs) {
        this.id = id;
        this.startMs = startMs;
        this.endMs = endMs;
    }

    public String getId() {
        return id;
    }

    public long getStartMs() {
        return startMs;
    }

    public long getEndMs() {
        return endMs;
    }

    public long getDurationMs() {
        return Math.max(0, endMs - startMs);
    }

    public boolean contains(long timelineMs) {
        return timelineMs >= startMs && timelineMs < endMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutputWindow)) return false;
        OutputWindow other = (OutputWindow) o;
        return startMs == other.startMs && endMs == other.endMs
            && (id == null ? other.id == null : id.equals(other.id));
    }

    @Override
    public int hashCode() {
        int h = id == null ? 0 : id.hashCode();
        h = 31 * h + Long.hashCode(startMs);
        return 31 * h + Long.hashCode(endMs);
    }

    @Override
    public String toString() {
        return "OutputWindow[" + id + ": " + startMs + "-" + endMs + "]";
    }
}
