package camflow.core.motion;

import camflow.core.events.HoverEvent;
import camflow.core.events.MouseEvent;
import camflow.core.model.Point;
import camflow.core.model.Size;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Finds stretches where the cursor stays inside a small box for a minimum time and
 * turns each into a synthetic {@link HoverEvent}. Boundary events (clicks, scrolls,
 * navigations) always end a hover: no hover spans a boundary timestamp.
 *
 * <p>Single left-to-right scan. Samples and boundaries may be passed in any order;
 * sorted copies are used.</p>
 */
public final class HoverDetector {

    public static final double DEFAULT_BOX_FRACTION = 0.1;
    public static final long DEFAULT_MIN_DURATION_MS = 1000;

    private final double boxSize;
    private final long minDurationMs;

    public HoverDetector(Size inputSize) {
        this(inputSize, DEFAULT_BOX_FRACTION, DEFAULT_MIN_DURATION_MS);
    }

    public HoverDetector(Size inputSize, double boxFraction, long minDurationMs) {
        this.boxSize = Math.max(inputSize.getWidth(), inputSize.getHeight()) * boxFraction;
        this.minDurationMs = minDurationMs;
    }

    public double getBoxSize() {
        return boxSize;
    }

    public long getMinDurationMs() {
        return minDurationMs;
    }

    public List<HoverEvent> detect(List<MouseEvent> mouseSamples, Collection<Long> boundaryTimes) {
        List<MouseEvent> samples = new ArrayList<>(mouseSamples);
        samples.sort(Comparator.comparingLong(MouseEvent::getTimestamp));

        long[] boundaries = new long[boundaryTimes.size()];
        int b = 0;
        for (Long t : boundaryTimes) {
            boundaries[b++] = t;
        }
        Arrays.sort(boundaries);

        List<HoverEvent> hovers = new ArrayList<>();
        int n = samples.size();
        int boundaryIdx = 0;
        int i = 0;

        while (i < n) {
            long startTime = samples.get(i).getTimestamp();

            while (boundaryIdx < boundaries.length && boundaries[boundaryIdx] < startTime) {
                boundaryIdx++;
            }
            // A sample sharing its timestamp with a boundary belongs to the interaction
            if (boundaryIdx < boundaries.length && boundaries[boundaryIdx] == startTime) {
                i++;
                continue;
            }
            long nextBoundary = boundaryIdx < boundaries.length ? boundaries[boundaryIdx] : Long.MAX_VALUE;

            if (nextBoundary != Long.MAX_VALUE && startTime + minDurationMs >= nextBoundary) {
                i++;
                continue;
            }

            Point first = samples.get(i).getPosition();
            double minX = first.getX();
            double maxX = minX;
            double minY = first.getY();
            double maxY = minY;
            int validEnd = -1;

            int j = i;
            while (j < n) {
                MouseEvent sample = samples.get(j);
                if (sample.getTimestamp() >= nextBoundary) break;

                Point p = sample.getPosition();
                double newMinX = Math.min(minX, p.getX());
                double newMaxX = Math.max(maxX, p.getX());
                double newMinY = Math.min(minY, p.getY());
                double newMaxY = Math.max(maxY, p.getY());
                if (newMaxX - newMinX > boxSize || newMaxY - newMinY > boxSize) break;

                minX = newMinX;
                maxX = newMaxX;
                minY = newMinY;
                maxY = newMaxY;
                if (sample.getTimestamp() - startTime >= minDurationMs) {
                    validEnd = j;
                }
                j++;
            }

            if (validEnd < 0) {
                i++;
                continue;
            }

            double sumX = 0;
            double sumY = 0;
            for (int k = i; k <= validEnd; k++) {
                Point p = samples.get(k).getPosition();
                sumX += p.getX();
                sumY += p.getY();
            }
            int count = validEnd - i + 1;
            hovers.add(new HoverEvent(startTime, samples.get(validEnd).getTimestamp(),
                new Point(sumX / count, sumY / count)));
            i = validEnd + 1;
        }
        return hovers;
    }
}
