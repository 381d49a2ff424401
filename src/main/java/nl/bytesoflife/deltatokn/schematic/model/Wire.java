package nl.bytesoflife.deltatokn.schematic.model;

import java.util.List;

/**
 * A wire polyline. Only consecutive point pairs form electrical segments.
 */
public record Wire(List<Point> points, String uuid) {

    public Wire {
        if (points.size() < 2) {
            throw new IllegalArgumentException("A wire needs at least two points, got " + points.size());
        }
        points = List.copyOf(points);
    }

    public Point start() {
        return points.get(0);
    }

    public Point end() {
        return points.get(points.size() - 1);
    }
}
