package camflow.core.view;

import camflow.core.model.Point;
import camflow.core.model.ProjectedBox;
import camflow.core.model.Rect;
import camflow.core.model.RenderRects;
import camflow.core.model.Size;

/**
 * Places the source recording inside the output canvas ("contain" fit with optional
 * padding) and projects points and rects between source space, output space and the
 * screen as seen through a camera viewport.
 *
 * <p>When either size has a zero dimension the mapper degrades to an identity
 * projection with an empty content rect instead of dividing by zero.</p>
 */
public final class ViewMapper {

    private final Size inputSize;
    private final Size outputSize;
    private final double paddingFraction;
    private final ProjectedBox projectedBox;
    private final Rect contentRect;
    private final boolean degenerate;

    public ViewMapper(Size inputSize, Size outputSize, double paddingFraction) {
        if (Double.isNaN(paddingFraction) || paddingFraction < 0 || paddingFraction >= 0.5) {
            throw new IllegalArgumentException("Padding fraction must be in [0, 0.5): " + paddingFraction);
        }
        this.inputSize = inputSize;
        this.outputSize = outputSize;
        this.paddingFraction = paddingFraction;
        this.degenerate = inputSize.isEmpty() || outputSize.isEmpty();
        this.projectedBox = degenerate ? new ProjectedBox(0, 0, 0, 0, 1.0) : computeProjectedBox();
        this.contentRect = projectedBox.toRect();
    }

    private ProjectedBox computeProjectedBox() {
        double usable = 1 - 2 * paddingFraction;
        double availableW = outputSize.getWidth() * usable;
        double availableH = outputSize.getHeight() * usable;

        double ratioW = inputSize.getWidth() / availableW;
        double ratioH = inputSize.getHeight() / availableH;
        double scale = Math.max(ratioW, ratioH);

        // The dominant axis is taken straight from the padded canvas so it fits exactly
        double projectedWidth;
        double projectedHeight;
        if (ratioW >= ratioH) {
            projectedWidth = availableW;
            projectedHeight = inputSize.getHeight() / scale;
        } else {
            projectedWidth = inputSize.getWidth() / scale;
            projectedHeight = availableH;
        }

        double x = (outputSize.getWidth() - projectedWidth) / 2;
        double y = (outputSize.getHeight() - projectedHeight) / 2;
        return new ProjectedBox(x, y, projectedWidth, projectedHeight, scale);
    }

    public Size getInputSize() {
        return inputSize;
    }

    public Size getOutputSize() {
        return outputSize;
    }

    public double getPaddingFraction() {
        return paddingFraction;
    }

    public ProjectedBox getProjectedBox() {
        return projectedBox;
    }

    /** The rect in output space where the source content is drawn. */
    public Rect getContentRect() {
        return contentRect;
    }

    // --- Source <-> Output ---

    public Point inputToOutputPoint(Point p) {
        if (degenerate) return p;
        double nx = p.getX() / inputSize.getWidth();
        double ny = p.getY() / inputSize.getHeight();
        return new Point(
            contentRect.getX() + nx * contentRect.getWidth(),
            contentRect.getY() + ny * contentRect.getHeight());
    }

    public Point outputToInputPoint(Point p) {
        if (degenerate) return p;
        double nx = (p.getX() - contentRect.getX()) / contentRect.getWidth();
        double ny = (p.getY() - contentRect.getY()) / contentRect.getHeight();
        return new Point(nx * inputSize.getWidth(), ny * inputSize.getHeight());
    }

    public Rect inputToOutputRect(Rect r) {
        Point p1 = inputToOutputPoint(new Point(r.getX(), r.getY()));
        Point p2 = inputToOutputPoint(new Point(r.getRight(), r.getBottom()));
        return new Rect(
            Math.min(p1.getX(), p2.getX()),
            Math.min(p1.getY(), p2.getY()),
            Math.abs(p2.getX() - p1.getX()),
            Math.abs(p2.getY() - p1.getY()));
    }

    // --- Viewport / screen ---

    /**
     * Works out which part of the source to sample and where to draw it for the given
     * camera viewport (output space). Returns {@code null} when the viewport sees only
     * padding, in which case no video frame is drawn.
     */
    public RenderRects resolveRenderRects(Rect viewport) {
        Rect intersection = viewport.intersect(contentRect);
        if (intersection == null || degenerate) {
            return null;
        }

        double srcX = (intersection.getX() - contentRect.getX()) / contentRect.getWidth() * inputSize.getWidth();
        double srcY = (intersection.getY() - contentRect.getY()) / contentRect.getHeight() * inputSize.getHeight();
        double srcW = intersection.getWidth() / contentRect.getWidth() * inputSize.getWidth();
        double srcH = intersection.getHeight() / contentRect.getHeight() * inputSize.getHeight();

        double scaleX = screenScale(outputSize.getWidth(), viewport.getWidth());
        double scaleY = screenScale(outputSize.getHeight(), viewport.getHeight());

        Rect dest = new Rect(
            (intersection.getX() - viewport.getX()) * scaleX,
            (intersection.getY() - viewport.getY()) * scaleY,
            intersection.getWidth() * scaleX,
            intersection.getHeight() * scaleY);

        return new RenderRects(new Rect(srcX, srcY, srcW, srcH), dest);
    }

    /** Source point to screen pixels, as seen through {@code viewport}. */
    public Point projectToScreen(Point p, Rect viewport) {
        Point out = inputToOutputPoint(p);
        double scaleX = screenScale(outputSize.getWidth(), viewport.getWidth());
        double scaleY = screenScale(outputSize.getHeight(), viewport.getHeight());
        return new Point((out.getX() - viewport.getX()) * scaleX, (out.getY() - viewport.getY()) * scaleY);
    }

    /**
     * 1.0 when the viewport is the whole canvas, 2.0 when it is half as wide.
     */
    public double getZoomScale(Rect viewport) {
        return screenScale(outputSize.getWidth(), viewport.getWidth());
    }

    private static double screenScale(double outputDim, double viewportDim) {
        if (viewportDim <= 0 || outputDim <= 0) return 1.0;
        return outputDim / viewportDim;
    }
}
