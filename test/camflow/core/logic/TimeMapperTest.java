package camflow.core.logic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import camflow.core.model.OutputRange;
import camflow.core.model.OutputWindow;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeMapperTest {

    private static final List<OutputWindow> GAPPED = Arrays.asList(
        new OutputWindow("1", 0, 500),
        new OutputWindow("2", 1000, 1500));

    @Test
    void continuousWindow() {
        TimeMapper mapper = new TimeMapper(0, Collections.singletonList(new OutputWindow("1", 0, 1000)));

        assertEquals(0, mapper.mapTimelineToOutputTime(0));
        assertEquals(500, mapper.mapTimelineToOutputTime(500));
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapTimelineToOutputTime(1000));

        assertEquals(0, mapper.mapOutputToTimelineTime(0));
        assertEquals(500, mapper.mapOutputToTimelineTime(500));
        assertEquals(1000, mapper.getOutputDuration());
    }

    @Test
    void windowsWithGap() {
        TimeMapper mapper = new TimeMapper(0, GAPPED);

        assertEquals(1000, mapper.getOutputDuration());
        assertEquals(0, mapper.mapTimelineToOutputTime(0));
        assertEquals(499, mapper.mapTimelineToOutputTime(499));
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapTimelineToOutputTime(500));
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapTimelineToOutputTime(999));
        assertEquals(500, mapper.mapTimelineToOutputTime(1000));
        assertEquals(750, mapper.mapTimelineToOutputTime(1250));

        assertEquals(0, mapper.mapOutputToTimelineTime(0));
        assertEquals(1000, mapper.mapOutputToTimelineTime(500));
        assertEquals(1250, mapper.mapOutputToTimelineTime(750));
    }

    @Test
    void everyGapTimeIsHidden() {
        for (long t = 501; t < 1000; t++) {
            assertEquals(TimeMapper.NOT_VISIBLE, TimeMapper.mapTimelineToOutputTime(t, GAPPED), "t=" + t);
        }
        assertEquals(TimeMapper.NOT_VISIBLE, TimeMapper.mapTimelineToOutputTime(1500, GAPPED));
        assertEquals(TimeMapper.NOT_VISIBLE, TimeMapper.mapTimelineToOutputTime(-1, GAPPED));
    }

    @Test
    void outputToTimelineInvertsEveryVisibleTime() {
        for (OutputWindow w : GAPPED) {
            for (long t = w.getStartMs(); t < w.getEndMs(); t += 7) {
                long out = TimeMapper.mapTimelineToOutputTime(t, GAPPED);
                assertEquals(t, TimeMapper.mapOutputToTimelineTime(out, GAPPED));
            }
        }
    }

    @Test
    void outputOutOfRange() {
        TimeMapper mapper = new TimeMapper(0, GAPPED);
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapOutputToTimelineTime(1000));
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapOutputToTimelineTime(-5));
    }

    @Test
    void timelineOffset() {
        TimeMapper mapper = new TimeMapper(-2000, Collections.singletonList(new OutputWindow("1", 0, 1000)));

        assertEquals(0, mapper.mapSourceToOutputTime(2000));
        assertEquals(500, mapper.mapSourceToOutputTime(2500));
        assertEquals(2500, mapper.mapOutputToSourceTime(500));
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapSourceToOutputTime(1999));
    }

    @Test
    void negativeSourceTimesStayDistinctFromSentinel() {
        TimeMapper mapper = new TimeMapper(1000, Collections.singletonList(new OutputWindow("1", 0, 2000)));
        assertEquals(-1, mapper.mapOutputToSourceTime(999));
        assertEquals(999, mapper.mapSourceToOutputTime(-1));
    }

    @Test
    void rangeMapping() {
        List<OutputWindow> windows = Arrays.asList(
            new OutputWindow("1", 0, 500),
            new OutputWindow("2", 1000, 2000));
        TimeMapper mapper = new TimeMapper(0, windows);

        assertEquals(new OutputRange(100, 400), mapper.mapSourceRangeToOutputRange(100, 400));
        // Runs into the gap: clamped at the window end
        assertEquals(new OutputRange(100, 500), mapper.mapSourceRangeToOutputRange(100, 1200));
        assertNull(mapper.mapSourceRangeToOutputRange(600, 800));
        assertEquals(new OutputRange(600, 700), mapper.mapSourceRangeToOutputRange(1100, 1200));
        assertNull(mapper.mapSourceRangeToOutputRange(2500, 2600));
    }

    @Test
    void zeroLengthWindowsAddNothing() {
        List<OutputWindow> windows = Arrays.asList(
            new OutputWindow("a", 0, 100),
            new OutputWindow("b", 200, 200),
            new OutputWindow("c", 300, 400));
        TimeMapper mapper = new TimeMapper(0, windows);

        assertEquals(200, mapper.getOutputDuration());
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapTimelineToOutputTime(200));
        assertEquals(150, mapper.mapTimelineToOutputTime(350));
        assertEquals(300, mapper.mapOutputToTimelineTime(100));
    }

    @Test
    void emptyWindowList() {
        TimeMapper mapper = new TimeMapper(0, Collections.emptyList());
        assertEquals(0, mapper.getOutputDuration());
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapTimelineToOutputTime(0));
        assertEquals(TimeMapper.NOT_VISIBLE, mapper.mapOutputToSourceTime(0));
        assertNull(mapper.mapSourceRangeToOutputRange(0, 10));
    }

    @Test
    void durationIsSumOfWindows() {
        List<OutputWindow> windows = Arrays.asList(
            new OutputWindow("a", 10, 70),
            new OutputWindow("b", 100, 130),
            new OutputWindow("c", 500, 1500));
        assertEquals(60 + 30 + 1000, TimeMapper.getOutputDuration(windows));
    }

    @Test
    void windowValidation() {
        assertTrue(TimeMapper.validateWindows(GAPPED));
        assertTrue(TimeMapper.validateWindows(Collections.emptyList()));
        assertFalse(TimeMapper.validateWindows(Arrays.asList(
            new OutputWindow("1", 1000, 1500), new OutputWindow("2", 0, 500))));
        assertFalse(TimeMapper.validateWindows(Arrays.asList(
            new OutputWindow("1", 0, 600), new OutputWindow("2", 500, 900))));
        assertFalse(TimeMapper.validateWindows(Collections.singletonList(new OutputWindow("1", 10, 5))));
    }

    @Test
    void windowsAreCopied() {
        List<OutputWindow> windows = new java.util.ArrayList<>(GAPPED);
        TimeMapper mapper = new TimeMapper(0, windows);
        windows.clear();
        assertNotNull(mapper.getWindows());
        assertEquals(1000, mapper.getOutputDuration());
        assertEquals(500, mapper.mapTimelineToOutputTime(1000));
    }
}
