package camflow.core.motion;

import camflow.core.config.EngineSettings;
import camflow.core.events.EventType;
import camflow.core.events.HoverEvent;
import camflow.core.events.MouseEvent;
import camflow.core.events.ScrollEvent;
import camflow.core.events.TypingEvent;
import camflow.core.events.UserEvent;
import camflow.core.logic.TimeMapper;
import camflow.core.model.OutputRange;
import camflow.core.model.Point;
import camflow.core.model.Rect;
import camflow.core.model.Size;
import camflow.core.model.ViewportMotion;
import camflow.core.view.ViewMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the recorded interactions into the camera schedule: the shortest list of
 * {@link ViewportMotion}s that keeps every important moment in frame.
 *
 * <p>Events are processed in output-time order against the last emitted viewport.
 * Hovers only move the camera when their target has left the frame; explicit
 * events (click, scroll, typing, navigation) also move it when the zoom level
 * they want differs from the current one. Nothing is kept between calls, so the
 * same inputs always yield an equal list.</p>
 */
public final class ViewportMotionScheduler {

    private final ViewMapper viewMapper;
    private final EngineSettings settings;
    private final Size outputSize;
    private final Rect fullRect;

    public ViewportMotionScheduler(ViewMapper viewMapper, EngineSettings settings) {
        this.viewMapper = viewMapper;
        this.settings = settings.copy();
        this.outputSize = viewMapper.getOutputSize();
        this.fullRect = Rect.full(outputSize);
    }

    public List<ViewportMotion> calculateZoomSchedule(List<? extends UserEvent> sourceEvents, TimeMapper timeMapper) {
        List<UserEvent> outputEvents = mapToOutputTime(sourceEvents, timeMapper);

        // --- Hovers (from output-time samples) ---
        List<MouseEvent> samples = new ArrayList<>();
        List<Long> boundaries = new ArrayList<>();
        List<UserEvent> relevant = new ArrayList<>();
        for (UserEvent e : outputEvents) {
            if (e.getType() == EventType.MOUSE) {
                samples.add((MouseEvent) e);
            }
            if (e.getType().isHoverBoundary()) {
                boundaries.add(e.getTimestamp());
            }
            if (e.getType().isCameraRelevant()) {
                relevant.add(e);
            }
        }
        HoverDetector hoverDetector = new HoverDetector(viewMapper.getInputSize(),
            settings.getHoverBoxFraction(), settings.getHoverMinDurationMs());
        relevant.addAll(hoverDetector.detect(samples, boundaries));

        // Stable: ties keep input order, then detected hovers
        relevant.sort(Comparator.comparingLong(UserEvent::getTimestamp));

        // --- Motions ---
        long outputEnd = timeMapper.getOutputDuration();
        long triggerCutoff = outputEnd - settings.getEndBufferMs();
        long transition = settings.getTransitionDurationMs();
        double epsilon = settings.getSizeEpsilonPx();

        List<ViewportMotion> motions = new ArrayList<>();
        Rect lastViewport = fullRect;

        for (UserEvent evt : relevant) {
            if (evt.getTimestamp() >= triggerCutoff) break;

            Rect mustSee = getMustSeeRect(evt);
            Rect target = getViewport(mustSee);
            boolean outOfFrame = !lastViewport.contains(mustSee);

            boolean emit;
            if (evt.getType() == EventType.HOVER) {
                emit = outOfFrame;
            } else {
                emit = outOfFrame || !target.sameSize(lastViewport, epsilon);
            }
            if (!emit) continue;

            long sourceEnd = timeMapper.mapOutputToSourceTime(evt.getTimestamp());
            if (sourceEnd == TimeMapper.NOT_VISIBLE) continue;

            motions.add(new ViewportMotion(sourceEnd, transition, target, evt.getType()));
            lastViewport = target;
        }

        if (!lastViewport.approximatelyEquals(fullRect, epsilon) && outputEnd > 0) {
            long landing = triggerCutoff + transition;
            landing = Math.max(0, Math.min(landing, outputEnd - 1));
            long sourceEnd = timeMapper.mapOutputToSourceTime(landing);
            if (sourceEnd != TimeMapper.NOT_VISIBLE) {
                motions.add(new ViewportMotion(sourceEnd, transition, fullRect, null));
            }
        }

        return Collections.unmodifiableList(motions);
    }

    // --- Targets ---

    /**
     * The smallest region (output space) the event needs on screen, clamped inside the canvas.
     */
    public Rect getMustSeeRect(UserEvent evt) {
        switch (evt.getType()) {
            case CLICK:
            case HOVER:
                return pointMustSee(evt.getPosition());
            case SCROLL:
                ScrollEvent scroll = (ScrollEvent) evt;
                return targetMustSee(scroll.getTargetRect(), scroll.getPosition());
            case TYPING:
                TypingEvent typing = (TypingEvent) evt;
                return targetMustSee(typing.getTargetRect(), typing.getPosition());
            case URL:
            default:
                return fullRect;
        }
    }

    private Rect pointMustSee(Point sourcePos) {
        if (sourcePos == null) return fullRect;
        Point center = viewMapper.inputToOutputPoint(sourcePos);
        double w = outputSize.getWidth() / (2 * settings.getMaxZoom());
        double h = outputSize.getHeight() / (2 * settings.getMaxZoom());
        return clampToCanvas(Rect.centeredOn(center.getX(), center.getY(), w, h));
    }

    private Rect targetMustSee(Rect sourceTarget, Point sourceCursor) {
        if (sourceTarget == null) return pointMustSee(sourceCursor);

        Rect target = viewMapper.inputToOutputRect(sourceTarget);
        double grow = 1 + settings.getTargetPaddingFraction();
        double paddedW = Math.min(target.getWidth() * grow, outputSize.getWidth());
        double paddedH = target.getHeight() * grow;
        Point targetCenter = target.center();

        double viewportH = Math.max(paddedW, minViewportWidth()) / outputSize.getAspectRatio();
        if (paddedH <= viewportH || sourceCursor == null) {
            return clampToCanvas(Rect.centeredOn(targetCenter.getX(), targetCenter.getY(), paddedW, paddedH));
        }

        // Taller than the frame can show at this width: follow the cursor vertically
        Point cursor = viewMapper.inputToOutputPoint(sourceCursor);
        return clampToCanvas(Rect.centeredOn(targetCenter.getX(), cursor.getY(), paddedW, viewportH));
    }

    /**
     * Camera window for a must-see rect: at least output / maxZoom, large enough to hold
     * the must-see rect, output aspect ratio, centered on it and clamped to the canvas.
     */
    public Rect getViewport(Rect mustSee) {
        double aspect = outputSize.getAspectRatio();
        double width = Math.max(minViewportWidth(), Math.max(mustSee.getWidth(), mustSee.getHeight() * aspect));
        double height = width / aspect;
        if (width >= outputSize.getWidth() || height >= outputSize.getHeight()) {
            return fullRect;
        }
        Point c = mustSee.center();
        return clampToCanvas(Rect.centeredOn(c.getX(), c.getY(), width, height));
    }

    private double minViewportWidth() {
        return outputSize.getWidth() / settings.getMaxZoom();
    }

    private Rect clampToCanvas(Rect r) {
        double w = Math.min(r.getWidth(), outputSize.getWidth());
        double h = Math.min(r.getHeight(), outputSize.getHeight());
        double x = Math.max(0, Math.min(r.getX(), outputSize.getWidth() - w));
        double y = Math.max(0, Math.min(r.getY(), outputSize.getHeight() - h));
        return new Rect(x, y, w, h);
    }

    // --- Time mapping ---

    /**
     * Moves every event onto the output axis, dropping those that fall in cut gaps.
     * Hovers keep their end, clamped to the window their start plays in.
     */
    public static List<UserEvent> mapToOutputTime(List<? extends UserEvent> sourceEvents, TimeMapper timeMapper) {
        List<UserEvent> mapped = new ArrayList<>(sourceEvents.size());
        for (UserEvent e : sourceEvents) {
            if (e.getType() == EventType.HOVER) {
                HoverEvent hover = (HoverEvent) e;
                OutputRange range = timeMapper.mapSourceRangeToOutputRange(hover.getTimestamp(), hover.getEndTime());
                if (range != null) {
                    mapped.add(hover.withTimes(range.getStartMs(), range.getEndMs()));
                }
                continue;
            }
            long t = timeMapper.mapSourceToOutputTime(e.getTimestamp());
            if (t != TimeMapper.NOT_VISIBLE) {
                mapped.add(e.withTimestamp(t));
            }
        }
        return mapped;
    }
}
