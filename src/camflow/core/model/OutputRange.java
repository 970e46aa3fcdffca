package camflow.core.model;

/**
 * Half-open output-time interval produced by range mapping.
 */
public final class OutputRange {
    private final long startMs;
    private final long endMs;

    public OutputRange(long startMs, long endMs) {
        this.startMs = startMs;
        this.endMs = endMs;
    }

    public long getStartMs() {
        return startMs;
    }

    public long getEndMs() {
        return endMs;
    }

    public long getDurationMs() {
        return endMs - startMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutputRange)) return false;
        OutputRange other = (OutputRange) o;
        return startMs == other.startMs && endMs == other.endMs;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(startMs) + Long.hashCode(endMs);
    }

    @Override
    public String toString() {
        return "[" + startMs + ", " + endMs + ")";
    }
}
