package camflow.core.model;

/**
 * Where, and how much smaller, the source content is drawn inside the output canvas.
 * {@code scale} is source pixels per output pixel.
 */
public final class ProjectedBox {
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final double scale;

    public ProjectedBox(double x, double y, double width, double height, double scale) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.scale = scale;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }
    public double getScale() { return scale; }

    public Rect toRect() {
        return new Rect(x, y, width, height);
    }

    @Override
    public String toString() {
        return "ProjectedBox[" + x + ", " + y + ", " + width + "x" + height + " @ " + scale + "]";
    }
}
