package camflow.core.effects;

import camflow.core.events.MouseEvent;
import camflow.core.model.Point;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A press-move-release gesture with the cursor path it followed.
 * The path always holds at least the press sample.
 */
public final class DragGesture {
    private final List<MouseEvent> path;

    public DragGesture(List<MouseEvent> path) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("A drag needs at least one path sample");
        }
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    public long getStartTime() {
        return path.get(0).getTimestamp();
    }

    public long getEndTime() {
        return path.get(path.size() - 1).getTimestamp();
    }

    public Point getStart() {
        return path.get(0).getPosition();
    }

    public Point getEnd() {
        return path.get(path.size() - 1).getPosition();
    }

    public List<MouseEvent> getPath() {
        return path;
    }

    /** Cursor position along the drag at {@code timeMs}, clamped to the gesture. */
    public Point positionAt(long timeMs) {
        return CursorPath.interpolate(path, timeMs);
    }

    @Override
    public String toString() {
        return "DragGesture[" + getStartTime() + "-" + getEndTime() + ", " + path.size() + " samples]";
    }
}
