package camflow.core.track;

import camflow.core.config.EngineSettings;
import camflow.core.effects.CursorPath;
import camflow.core.effects.MouseEffect;
import camflow.core.effects.MouseEffectIndex;
import camflow.core.events.UserEvent;
import camflow.core.logic.TimeMapper;
import camflow.core.model.OutputWindow;
import camflow.core.model.Point;
import camflow.core.model.Rect;
import camflow.core.model.RenderRects;
import camflow.core.model.Size;
import camflow.core.model.ViewportMotion;
import camflow.core.motion.ViewportMotionScheduler;
import camflow.core.motion.ViewportStateInterpolator;
import camflow.core.view.ViewMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * State holder for the camera track of one recording.
 * Every edit bumps the revision and notifies listeners; the schedule and the per-frame
 * lookups are rebuilt lazily, once per revision, on the first query that needs them.
 * Queries work on an immutable snapshot and may run from any thread.
 */
public class CameraTrackModel {

    // Core Data
    private final List<UserEvent> events = new ArrayList<>();
    private List<OutputWindow> outputWindows = new ArrayList<>();
    private long timelineOffsetMs;
    private Size inputSize;
    private Size outputSize;
    private EngineSettings settings = new EngineSettings();

    // State Tracking
    private final AtomicLong layoutRevision = new AtomicLong(0);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile Snapshot snapshot;

    // Listeners
    public interface ModelListener {
        void onModelUpdated();
    }
    private final List<ModelListener> listeners = new CopyOnWriteArrayList<>();

    public CameraTrackModel(Size inputSize, Size outputSize) {
        this.inputSize = inputSize;
        this.outputSize = outputSize;
    }

    // --- Events ---

    public void setEvents(List<? extends UserEvent> newEvents) {
        edit(() -> {
            events.clear();
            events.addAll(newEvents);
        });
    }

    public void addEvent(UserEvent event) {
        edit(() -> events.add(event));
    }

    public void clearEvents() {
        edit(events::clear);
    }

    public List<UserEvent> getEvents() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(events);
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- Timeline ---

    public void setOutputWindows(List<OutputWindow> windows) {
        if (!TimeMapper.validateWindows(windows)) {
            System.err.println("[CameraTrackModel] Output windows are unsorted or overlapping; time mapping is best effort.");
        }
        edit(() -> outputWindows = new ArrayList<>(windows));
    }

    public List<OutputWindow> getOutputWindows() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(outputWindows));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setTimelineOffsetMs(long offsetMs) {
        edit(() -> timelineOffsetMs = offsetMs);
    }

    public long getTimelineOffsetMs() {
        lock.readLock().lock();
        try {
            return timelineOffsetMs;
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- Geometry & Settings ---

    public void setInputSize(Size size) {
        edit(() -> inputSize = size);
    }

    public void setOutputSize(Size size) {
        edit(() -> outputSize = size);
    }

    public void setSettings(EngineSettings newSettings) {
        EngineSettings copy = newSettings.copy();
        edit(() -> settings = copy);
    }

    public EngineSettings getSettings() {
        lock.readLock().lock();
        try {
            return settings.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- Queries ---

    public List<ViewportMotion> getMotions() {
        return snapshot().motions;
    }

    public long getOutputDuration() {
        return snapshot().timeMapper.getOutputDuration();
    }

    public TimeMapper getTimeMapper() {
        return snapshot().timeMapper;
    }

    public ViewMapper getViewMapper() {
        return snapshot().viewMapper;
    }

    /** Camera rect (output space) at an output time. */
    public Rect getViewportAt(long outputTimeMs) {
        return snapshot().interpolator.getViewportStateAtTime(outputTimeMs);
    }

    /** Source/destination rects to draw the frame at an output time; null when only padding is visible. */
    public RenderRects resolveRenderRectsAt(long outputTimeMs) {
        Snapshot s = snapshot();
        return s.viewMapper.resolveRenderRects(s.interpolator.getViewportStateAtTime(outputTimeMs));
    }

    public List<MouseEffect> getActiveEffectsAt(long outputTimeMs) {
        Snapshot s = snapshot();
        long sourceMs = s.timeMapper.mapOutputToSourceTime(outputTimeMs);
        if (sourceMs == TimeMapper.NOT_VISIBLE) return Collections.emptyList();
        return s.effects.getActiveEffects(sourceMs);
    }

    /** Cursor position in screen pixels at an output time, or null without mouse samples. */
    public Point getCursorAt(long outputTimeMs) {
        Snapshot s = snapshot();
        long sourceMs = s.timeMapper.mapOutputToSourceTime(outputTimeMs);
        if (sourceMs == TimeMapper.NOT_VISIBLE) return null;
        Point source = s.cursor.positionAt(sourceMs);
        if (source == null) return null;
        return s.viewMapper.projectToScreen(source, s.interpolator.getViewportStateAtTime(outputTimeMs));
    }

    // --- Revision ---

    public long getLayoutRevision() {
        return layoutRevision.get();
    }

    public void incrementRevision() {
        layoutRevision.incrementAndGet();
    }

    // --- Listeners ---

    public void addListener(ModelListener l) {
        listeners.add(l);
    }

    public void removeListener(ModelListener l) {
        listeners.remove(l);
    }

    public void fireUpdate() {
        for (ModelListener l : listeners) {
            l.onModelUpdated();
        }
    }

    // --- Internals ---

    private void edit(Runnable modification) {
        lock.writeLock().lock();
        try {
            modification.run();
            incrementRevision();
        } finally {
            lock.writeLock().unlock();
        }
        fireUpdate();
    }

    private Snapshot snapshot() {
        Snapshot current = snapshot;
        if (current != null && current.revision == layoutRevision.get()) {
            return current;
        }
        lock.writeLock().lock();
        try {
            long revision = layoutRevision.get();
            if (snapshot == null || snapshot.revision != revision) {
                snapshot = rebuild(revision);
            }
            return snapshot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Snapshot rebuild(long revision) {
        long t0 = System.nanoTime();
        TimeMapper timeMapper = new TimeMapper(timelineOffsetMs, outputWindows);
        ViewMapper viewMapper = new ViewMapper(inputSize, outputSize, settings.getPaddingFraction());
        List<UserEvent> eventsCopy = new ArrayList<>(events);

        List<ViewportMotion> motions = new ViewportMotionScheduler(viewMapper, settings)
            .calculateZoomSchedule(eventsCopy, timeMapper);
        ViewportStateInterpolator interpolator = ViewportStateInterpolator.prepare(
            motions, outputSize, timeMapper, settings.getTransitionEasing());
        MouseEffectIndex effects = new MouseEffectIndex(eventsCopy, settings.getClickEffectDurationMs());
        CursorPath cursor = CursorPath.fromEvents(eventsCopy);

        System.out.printf("[CameraTrackModel] Schedule rebuilt (rev %d): %d events -> %d motions in %.2f ms%n",
            revision, eventsCopy.size(), motions.size(), (System.nanoTime() - t0) / 1_000_000.0);
        return new Snapshot(revision, timeMapper, viewMapper, motions, interpolator, effects, cursor);
    }

    private static final class Snapshot {
        final long revision;
        final TimeMapper timeMapper;
        final ViewMapper viewMapper;
        final List<ViewportMotion> motions;
        final ViewportStateInterpolator interpolator;
        final MouseEffectIndex effects;
        final CursorPath cursor;

        Snapshot(long revision, TimeMapper timeMapper, ViewMapper viewMapper, List<ViewportMotion> motions,
                 ViewportStateInterpolator interpolator, MouseEffectIndex effects, CursorPath cursor) {
            this.revision = revision;
            this.timeMapper = timeMapper;
            this.viewMapper = viewMapper;
            this.motions = motions;
            this.interpolator = interpolator;
            this.effects = effects;
            this.cursor = cursor;
        }
    }
}
