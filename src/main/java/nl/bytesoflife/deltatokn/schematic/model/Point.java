package nl.bytesoflife.deltatokn.schematic.model;

import java.util.Locale;

/**
 * A schematic coordinate in millimetres. Equality and hashing use the coordinates rounded to four
 * decimals so points computed through rotation compare equal to the grid points they land on.
 */
public record Point(double x, double y) {

    private static final double PRECISION = 10_000.0;

    public boolean isWithin(Point other, double tolerance) {
        return Math.abs(x - other.x) < tolerance && Math.abs(y - other.y) < tolerance;
    }

    private long roundedX() {
        return Math.round(x * PRECISION);
    }

    private long roundedY() {
        return Math.round(y * PRECISION);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point other)) return false;
        return roundedX() == other.roundedX() && roundedY() == other.roundedY();
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(roundedX()) + Long.hashCode(roundedY());
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.4f, %.4f)", x, y);
    }
}
