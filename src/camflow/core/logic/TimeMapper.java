package camflow.core.logic;

import camflow.core.model.OutputRange;
import camflow.core.model.OutputWindow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts between the three time axes of a project:
 * <ul>
 *   <li>Source time: raw recording timestamps.</li>
 *   <li>Timeline time: source time shifted by the clip offset, cut gaps included.</li>
 *   <li>Output time: continuous time of the exported video, gaps removed.</li>
 * </ul>
 * Windows are walked in list order and are expected sorted and non-overlapping.
 * A badly ordered list gives inconsistent answers but never loops or throws.
 */
public final class TimeMapper {

    /** Returned for any time that does not survive the cut. Never a legal time on any axis. */
    public static final long NOT_VISIBLE = Long.MIN_VALUE;

    private final long timelineOffsetMs;
    private final List<OutputWindow> windows;
    private final long outputDurationMs;

    public TimeMapper(long timelineOffsetMs, List<OutputWindow> windows) {
        this.timelineOffsetMs = timelineOffsetMs;
        this.windows = Collections.unmodifiableList(new ArrayList<>(windows));
        this.outputDurationMs = getOutputDuration(this.windows);
    }

    public long getTimelineOffsetMs() {
        return timelineOffsetMs;
    }

    public List<OutputWindow> getWindows() {
        return windows;
    }

    public long getOutputDuration() {
        return outputDurationMs;
    }

    public long mapTimelineToOutputTime(long timelineMs) {
        return mapTimelineToOutputTime(timelineMs, windows);
    }

    public long mapOutputToTimelineTime(long outputMs) {
        return mapOutputToTimelineTime(outputMs, windows);
    }

    public long mapSourceToOutputTime(long sourceMs) {
        return mapTimelineToOutputTime(sourceMs + timelineOffsetMs, windows);
    }

    public long mapOutputToSourceTime(long outputMs) {
        long timelineMs = mapOutputToTimelineTime(outputMs, windows);
        if (timelineMs == NOT_VISIBLE) return NOT_VISIBLE;
        return timelineMs - timelineOffsetMs;
    }

    /**
     * Clamps the source interval [startMs, endMs) to the part that plays contiguously
     * from its start. Returns {@code null} when the start itself is cut away.
     * An interval that runs into a gap is shortened at the end of its window.
     */
    public OutputRange mapSourceRangeToOutputRange(long startMs, long endMs) {
        long timelineStart = startMs + timelineOffsetMs;
        long timelineEnd = endMs + timelineOffsetMs;

        long accumulator = 0;
        for (OutputWindow win : windows) {
            if (win.contains(timelineStart)) {
                long clampedEnd = Math.min(Math.max(timelineEnd, timelineStart), win.getEndMs());
                long outStart = accumulator + (timelineStart - win.getStartMs());
                return new OutputRange(outStart, outStart + (clampedEnd - timelineStart));
            } else if (timelineStart < win.getStartMs()) {
                return null;
            }
            accumulator += win.getDurationMs();
        }
        return null;
    }

    // --- Window walking ---

    public static long mapTimelineToOutputTime(long timelineMs, List<OutputWindow> windows) {
        long accumulator = 0;
        for (OutputWindow win : windows) {
            if (win.contains(timelineMs)) {
                return accumulator + (timelineMs - win.getStartMs());
            } else if (timelineMs < win.getStartMs()) {
                // Before this window and not inside any earlier one: a gap
                return NOT_VISIBLE;
            }
            accumulator += win.getDurationMs();
        }
        return NOT_VISIBLE;
    }

    public static long mapOutputToTimelineTime(long outputMs, List<OutputWindow> windows) {
        if (outputMs < 0) return NOT_VISIBLE;
        long accumulator = 0;
        for (OutputWindow win : windows) {
            long duration = win.getDurationMs();
            if (outputMs < accumulator + duration) {
                return win.getStartMs() + (outputMs - accumulator);
            }
            accumulator += duration;
        }
        return NOT_VISIBLE;
    }

    public static long getOutputDuration(List<OutputWindow> windows) {
        long total = 0;
        for (OutputWindow win : windows) {
            total += win.getDurationMs();
        }
        return total;
    }

    /**
     * Checks the ordering contract: every window well-formed, sorted by start and not
     * overlapping its predecessor.
     */
    public static boolean validateWindows(List<OutputWindow> windows) {
        long previousEnd = Long.MIN_VALUE;
        for (OutputWindow win : windows) {
            if (win.getEndMs() < win.getStartMs()) return false;
            if (win.getStartMs() < previousEnd) return false;
            previousEnd = win.getEndMs();
        }
        return true;
    }
}
