package camflow.core.effects;

import camflow.core.events.MouseEvent;
import camflow.core.events.UserEvent;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups mousedown, the mouse samples that follow it and the matching mouseup into
 * {@link DragGesture}s. A second mousedown while a drag is open is ignored; a drag
 * still open at the end of the stream is closed at its last sample.
 */
public final class DragDetector {

    private DragDetector() {
    }

    public static List<DragGesture> detect(List<? extends UserEvent> events) {
        List<UserEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingLong(UserEvent::getTimestamp));

        List<DragGesture> drags = new ArrayList<>();
        List<MouseEvent> active = null;

        for (UserEvent evt : ordered) {
            switch (evt.getType()) {
                case MOUSE_DOWN:
                    if (active == null) {
                        active = new ArrayList<>();
                        active.add(new MouseEvent(evt.getTimestamp(), evt.getPosition()));
                    }
                    break;
                case MOUSE:
                    if (active != null) {
                        active.add((MouseEvent) evt);
                    }
                    break;
                case MOUSE_UP:
                    if (active != null) {
                        active.add(new MouseEvent(evt.getTimestamp(), evt.getPosition()));
                        drags.add(new DragGesture(active));
                        active = null;
                    }
                    break;
                default:
                    break;
            }
        }

        if (active != null) {
            drags.add(new DragGesture(active));
        }
        return drags;
    }
}
