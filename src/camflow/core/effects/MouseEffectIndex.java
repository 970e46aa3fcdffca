package camflow.core.effects;

import camflow.core.events.ClickEvent;
import camflow.core.events.EventType;
import camflow.core.events.UserEvent;
import camflow.core.structure.IntervalTree;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-frame lookup of click ripples and drag indicators. Built once from events on
 * a single time axis; queried with a time on that same axis.
 */
public final class MouseEffectIndex {

    private final IntervalTree<ClickEvent> clicks = new IntervalTree<>();
    private final IntervalTree<DragGesture> drags = new IntervalTree<>();
    private final long clickDurationMs;

    public MouseEffectIndex(List<? extends UserEvent> events, long clickDurationMs) {
        this.clickDurationMs = clickDurationMs;
        for (UserEvent e : events) {
            if (e.getType() == EventType.CLICK) {
                // Keep zero-length clicks queryable at their own instant
                long end = e.getTimestamp() + Math.max(1, clickDurationMs);
                clicks.add(e.getTimestamp(), end, (ClickEvent) e);
            }
        }
        for (DragGesture drag : DragDetector.detect(events)) {
            drags.add(drag.getStartTime(), drag.getEndTime() + 1, drag);
        }
    }

    public int getClickCount() {
        return clicks.size();
    }

    public int getDragCount() {
        return drags.size();
    }

    public List<MouseEffect> getActiveEffects(long timeMs) {
        List<MouseEffect> active = new ArrayList<>();
        for (ClickEvent click : clicks.query(timeMs)) {
            double progress = clickDurationMs <= 0 ? 1.0
                : (double) (timeMs - click.getTimestamp()) / clickDurationMs;
            active.add(new MouseEffect(MouseEffect.Kind.CLICK, click.getPosition(), Math.min(1.0, progress)));
        }
        for (DragGesture drag : drags.query(timeMs)) {
            long span = drag.getEndTime() - drag.getStartTime();
            double progress = span <= 0 ? 1.0 : (double) (timeMs - drag.getStartTime()) / span;
            active.add(new MouseEffect(MouseEffect.Kind.DRAG, drag.positionAt(timeMs), Math.min(1.0, progress)));
        }
        return active;
    }
}
