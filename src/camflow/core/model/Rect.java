package camflow.core.model;

/**
 * Axis-aligned box. Used for the content-fit box, must-see regions and the camera viewport.
 */
public final class Rect {
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public Rect(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /** The whole canvas of the given size, anchored at the origin. */
    public static Rect full(Size size) {
        return new Rect(0, 0, size.getWidth(), size.getHeight());
    }

    public static Rect centeredOn(double cx, double cy, double width, double height) {
        return new Rect(cx - width / 2, cy - height / 2, width, height);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    public Point center() {
        return new Point(x + width / 2, y + height / 2);
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    /** Inclusive on every edge. */
    public boolean contains(Point p) {
        return p.getX() >= x && p.getX() <= getRight()
            && p.getY() >= y && p.getY() <= getBottom();
    }

    /** True when {@code other} lies fully inside this rect (edges may touch). */
    public boolean contains(Rect other) {
        return other.x >= x && other.y >= y
            && other.getRight() <= getRight()
            && other.getBottom() <= getBottom();
    }

    /**
     * Returns the overlapping region, or {@code null} when the rects do not overlap
     * with a positive area.
     */
    public Rect intersect(Rect other) {
        double ix = Math.max(x, other.x);
        double iy = Math.max(y, other.y);
        double iw = Math.min(getRight(), other.getRight()) - ix;
        double ih = Math.min(getBottom(), other.getBottom()) - iy;
        if (iw <= 0 || ih <= 0) {
            return null;
        }
        return new Rect(ix, iy, iw, ih);
    }

    public boolean sameSize(Rect other, double epsilon) {
        return Math.abs(width - other.width) <= epsilon && Math.abs(height - other.height) <= epsilon;
    }

    public boolean approximatelyEquals(Rect other, double epsilon) {
        return Math.abs(x - other.x) <= epsilon && Math.abs(y - other.y) <= epsilon && sameSize(other, epsilon);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rect)) return false;
        Rect other = (Rect) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
            && Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(x);
        h = 31 * h + Double.hashCode(y);
        h = 31 * h + Double.hashCode(width);
        return 31 * h + Double.hashCode(height);
    }

    @Override
    public String toString() {
        return "Rect[x=" + x + ", y=" + y + ", w=" + width + ", h=" + height + "]";
    }
}
