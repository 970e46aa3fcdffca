package camflow.core.model;

/**
 * The portion of the source bitmap to sample and where to draw it on screen for one frame.
 */
public final class RenderRects {
    private final Rect sourceRect;
    private final Rect destRect;

    public RenderRects(Rect sourceRect, Rect destRect) {
        this.sourceRect = sourceRect;
        this.destRect = destRect;
    }

    /** Region of the source recording, in source pixels. */
    public Rect getSourceRect() {
        return sourceRect;
    }

    /** Draw region on the output frame, in screen pixels. */
    public Rect getDestRect() {
        return destRect;
    }

    @Override
    public String toString() {
        return "RenderRects[src=" + sourceRect + ", dst=" + destRect + "]";
    }
}
