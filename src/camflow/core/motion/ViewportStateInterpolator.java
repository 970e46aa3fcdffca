package camflow.core.motion;

import camflow.core.logic.Easing;
import camflow.core.logic.TimeMapper;
import camflow.core.model.Rect;
import camflow.core.model.Size;
import camflow.core.model.ViewportMotion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Answers where the camera is at a given output time.
 *
 * <p>Motions are replayed in start order from the full canvas. When a motion starts
 * before the previous one has arrived, the previous one is frozen at that instant and
 * its partial rect becomes the starting point of the next, so the camera never jumps.
 * Progress is always measured against a motion's full duration, which keeps the speed
 * and shape of an interrupted transition unchanged.</p>
 *
 * <p>Instances are immutable. {@link #getViewportStateAtTime(long)} is the per-frame
 * call: linear in the number of motions and allocating only the returned rect.</p>
 */
public final class ViewportStateInterpolator {

    private final Easing easing;
    private final Rect fullRect;
    private final long[] startTimes;
    private final long[] endTimes;
    private final long[] durations;
    private final Rect[] targets;

    private ViewportStateInterpolator(Easing easing, Rect fullRect, List<Timed> timed) {
        this.easing = easing;
        this.fullRect = fullRect;
        int n = timed.size();
        this.startTimes = new long[n];
        this.endTimes = new long[n];
        this.durations = new long[n];
        this.targets = new Rect[n];
        for (int i = 0; i < n; i++) {
            Timed t = timed.get(i);
            startTimes[i] = t.startTime;
            endTimes[i] = t.endTime;
            durations[i] = t.motion.getDurationMs();
            targets[i] = t.motion.getRect();
        }
    }

    /**
     * Maps every motion onto output time, drops the ones whose arrival was cut away and
     * orders the rest by start time.
     */
    public static ViewportStateInterpolator prepare(List<ViewportMotion> motions, Size outputSize, TimeMapper timeMapper) {
        return prepare(motions, outputSize, timeMapper, Easing.EASE_IN_OUT);
    }

    public static ViewportStateInterpolator prepare(List<ViewportMotion> motions, Size outputSize,
                                                    TimeMapper timeMapper, Easing easing) {
        List<Timed> timed = new ArrayList<>(motions.size());
        for (ViewportMotion m : motions) {
            long end = timeMapper.mapSourceToOutputTime(m.getSourceEndTimeMs());
            if (end == TimeMapper.NOT_VISIBLE) continue;
            timed.add(new Timed(m, end - m.getDurationMs(), end));
        }
        // Stable sort keeps producer order for equal starts
        timed.sort(Comparator.comparingLong(t -> t.startTime));
        return new ViewportStateInterpolator(easing, Rect.full(outputSize), timed);
    }

    public static Rect getViewportStateAtTime(List<ViewportMotion> motions, long outputTimeMs,
                                              Size outputSize, TimeMapper timeMapper) {
        return prepare(motions, outputSize, timeMapper).getViewportStateAtTime(outputTimeMs);
    }

    public int getMotionCount() {
        return targets.length;
    }

    public long getStartTime(int index) {
        return startTimes[index];
    }

    public long getEndTime(int index) {
        return endTimes[index];
    }

    public Rect getViewportStateAtTime(long outputTimeMs) {
        double curX = fullRect.getX();
        double curY = fullRect.getY();
        double curW = fullRect.getWidth();
        double curH = fullRect.getHeight();

        int n = targets.length;
        for (int i = 0; i < n; i++) {
            long start = startTimes[i];
            if (outputTimeMs < start) {
                return new Rect(curX, curY, curW, curH);
            }

            long interruption = endTimes[i];
            if (i + 1 < n && startTimes[i + 1] < interruption) {
                interruption = startTimes[i + 1];
            }

            long limit = Math.min(outputTimeMs, interruption);
            double eased = easing.apply(progress(limit - start, durations[i]));

            Rect to = targets[i];
            double x = Easing.lerp(curX, to.getX(), eased);
            double y = Easing.lerp(curY, to.getY(), eased);
            double w = Easing.lerp(curW, to.getWidth(), eased);
            double h = Easing.lerp(curH, to.getHeight(), eased);

            if (outputTimeMs <= interruption) {
                return new Rect(x, y, w, h);
            }

            // Finished or interrupted: carry the reached state into the next motion
            curX = x;
            curY = y;
            curW = w;
            curH = h;
        }
        return new Rect(curX, curY, curW, curH);
    }

    private static double progress(long elapsed, long duration) {
        if (duration <= 0) return 1.0;
        double p = (double) elapsed / duration;
        if (p < 0) return 0;
        if (p > 1) return 1;
        return p;
    }

    private static final class Timed {
        final ViewportMotion motion;
        final long startTime;
        final long endTime;

        Timed(ViewportMotion motion, long startTime, long endTime) {
            this.motion = motion;
            this.startTime = startTime;
            this.endTime = endTime;
        }
    }
}
