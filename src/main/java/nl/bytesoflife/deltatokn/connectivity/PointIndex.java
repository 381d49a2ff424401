package nl.bytesoflife.deltatokn.connectivity;

import nl.bytesoflife.deltatokn.schematic.model.Point;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.Collection;
import java.util.List;

/**
 * Static point cloud answering "is any point within tolerance of p" queries. All points are added
 * before the first query.
 */
public class PointIndex {

    private final STRtree tree = new STRtree();
    private boolean built = false;
    private int size = 0;

    public PointIndex() {
    }

    public PointIndex(Collection<Point> points) {
        insertAll(points);
    }

    public void insert(Point point) {
        if (built) {
            throw new IllegalStateException("Cannot insert into a PointIndex after it has been queried");
        }
        tree.insert(new Envelope(point.x(), point.x(), point.y(), point.y()), point);
        size++;
    }

    public void insertAll(Collection<Point> points) {
        for (Point p : points) {
            insert(p);
        }
    }

    /**
     * True when some indexed point differs from {@code point} by less than {@code tolerance} on
     * both axes.
     */
    public boolean anyWithin(Point point, double tolerance) {
        if (size == 0) return false;
        for (Point candidate : query(point, tolerance)) {
            if (candidate.isWithin(point, tolerance)) {
                return true;
            }
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    private List<Point> query(Point point, double tolerance) {
        ensureBuilt();
        Envelope searchEnvelope = new Envelope(point.x(), point.x(), point.y(), point.y());
        searchEnvelope.expandBy(tolerance);
        return (List<Point>) tree.query(searchEnvelope);
    }

    public int size() {
        return size;
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }
}
