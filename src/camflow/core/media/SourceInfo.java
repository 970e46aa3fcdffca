package camflow.core.media;

import camflow.core.model.OutputWindow;
import camflow.core.model.Size;

/**
 * Metadata of a screen recording, as probed from its container.
 */
public final class SourceInfo {
    private final String filePath;
    private final int width;
    private final int height;
    private final long durationMs;
    private final double frameRate;

    public SourceInfo(String filePath, int width, int height, long durationMs, double frameRate) {
        this.filePath = filePath;
        this.width = width;
        this.height = height;
        this.durationMs = durationMs;
        this.frameRate = frameRate;
    }

    public String getFilePath() { return filePath; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public long getDurationMs() { return durationMs; }
    public double getFrameRate() { return frameRate; }

    /** Source space size for the view mapper. */
    public Size getSize() {
        return new Size(width, height);
    }

    /** The uncut edit: one window covering the whole recording placed at {@code timelineOffsetMs}. */
    public OutputWindow fullWindow(String id, long timelineOffsetMs) {
        return new OutputWindow(id, timelineOffsetMs, timelineOffsetMs + durationMs);
    }

    @Override
    public String toString() {
        return "SourceInfo[" + filePath + ", " + width + "x" + height + ", " + durationMs + " ms @ " + frameRate + " fps]";
    }
}
