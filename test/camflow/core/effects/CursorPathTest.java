package camflow.core.effects;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import camflow.core.events.ClickEvent;
import camflow.core.events.MouseButtonEvent;
import camflow.core.events.MouseEvent;
import camflow.core.events.UserEvent;
import camflow.core.model.Point;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class CursorPathTest {

    private final CursorPath path = new CursorPath(Arrays.asList(
        new MouseEvent(2000, new Point(300, 100)),
        new MouseEvent(1000, new Point(100, 100)),
        new MouseEvent(3000, new Point(300, 500))));

    @Test
    void emptyPathHasNoPosition() {
        CursorPath empty = new CursorPath(Collections.emptyList());
        assertTrue(empty.isEmpty());
        assertNull(empty.positionAt(0));
    }

    @Test
    void clampsOutsideRecordedRange() {
        assertEquals(new Point(100, 100), path.positionAt(0));
        assertEquals(new Point(300, 500), path.positionAt(10_000));
    }

    @Test
    void interpolatesBetweenSamples() {
        assertEquals(new Point(200, 100), path.positionAt(1500));
        assertEquals(new Point(300, 100), path.positionAt(2000));
        assertEquals(new Point(300, 200), path.positionAt(2250));
    }

    @Test
    void singleSampleIsConstant() {
        CursorPath one = new CursorPath(Collections.singletonList(new MouseEvent(500, new Point(7, 8))));
        assertEquals(new Point(7, 8), one.positionAt(0));
        assertEquals(new Point(7, 8), one.positionAt(900));
    }

    @Test
    void fromEventsKeepsOnlyMouseSamples() {
        List<UserEvent> events = Arrays.asList(
            new ClickEvent(0, new Point(999, 999)),
            MouseButtonEvent.down(50, new Point(888, 888)),
            new MouseEvent(100, new Point(10, 10)),
            new MouseEvent(200, new Point(20, 20)));

        CursorPath fromEvents = CursorPath.fromEvents(events);

        assertEquals(2, fromEvents.sampleCount());
        assertEquals(new Point(15, 15), fromEvents.positionAt(150));
    }
}
