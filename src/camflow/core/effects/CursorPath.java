package camflow.core.effects;

import camflow.core.events.EventType;
import camflow.core.events.MouseEvent;
import camflow.core.events.UserEvent;
import camflow.core.model.Point;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Time-sampled cursor track. Linear interpolation between adjacent samples,
 * clamped to the first and last sample outside the recorded range.
 */
public final class CursorPath {

    private final long[] times;
    private final double[] xs;
    private final double[] ys;

    public CursorPath(List<MouseEvent> samples) {
        List<MouseEvent> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparingLong(MouseEvent::getTimestamp));
        int n = sorted.size();
        times = new long[n];
        xs = new double[n];
        ys = new double[n];
        for (int i = 0; i < n; i++) {
            MouseEvent e = sorted.get(i);
            times[i] = e.getTimestamp();
            xs[i] = e.getPosition().getX();
            ys[i] = e.getPosition().getY();
        }
    }

    /** Builds a path from the {@code MOUSE} samples of a mixed event list. */
    public static CursorPath fromEvents(List<? extends UserEvent> events) {
        List<MouseEvent> samples = new ArrayList<>();
        for (UserEvent e : events) {
            if (e.getType() == EventType.MOUSE) {
                samples.add((MouseEvent) e);
            }
        }
        return new CursorPath(samples);
    }

    public int sampleCount() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    /** Cursor position at {@code timeMs}, or {@code null} when there are no samples. */
    public Point positionAt(long timeMs) {
        int n = times.length;
        if (n == 0) return null;
        if (n == 1 || timeMs <= times[0]) return new Point(xs[0], ys[0]);
        if (timeMs >= times[n - 1]) return new Point(xs[n - 1], ys[n - 1]);

        // Binary search for bracketing indices
        int lo = 0, hi = n - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] <= timeMs) lo = mid; else hi = mid;
        }

        long range = times[hi] - times[lo];
        double t = range == 0 ? 0 : (double) (timeMs - times[lo]) / range;
        return new Point(xs[lo] + (xs[hi] - xs[lo]) * t, ys[lo] + (ys[hi] - ys[lo]) * t);
    }

    /** Linear scan variant for short, already ordered paths such as a drag. */
    static Point interpolate(List<MouseEvent> path, long timeMs) {
        MouseEvent first = path.get(0);
        if (timeMs <= first.getTimestamp()) return first.getPosition();
        MouseEvent last = path.get(path.size() - 1);
        if (timeMs >= last.getTimestamp()) return last.getPosition();

        for (int i = 0; i < path.size() - 1; i++) {
            MouseEvent p1 = path.get(i);
            MouseEvent p2 = path.get(i + 1);
            if (timeMs >= p1.getTimestamp() && timeMs <= p2.getTimestamp()) {
                long range = p2.getTimestamp() - p1.getTimestamp();
                double t = range == 0 ? 0 : (double) (timeMs - p1.getTimestamp()) / range;
                Point a = p1.getPosition();
                Point b = p2.getPosition();
                return new Point(a.getX() + (b.getX() - a.getX()) * t, a.getY() + (b.getY() - a.getY()) * t);
            }
        }
        return first.getPosition();
    }
}
