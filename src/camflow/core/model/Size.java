package camflow.core.model;

/**
 * Pixel dimensions of a frame (source recording or output canvas).
 */
public final class Size {
    private final double width;
    private final double height;

    public Size(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getAspectRatio() {
        if (height == 0) return 1.0;
        return width / height;
    }

    /** True when either dimension is zero or negative. */
    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Size)) return false;
        Size other = (Size) o;
        return Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(width) + Double.hashCode(height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
