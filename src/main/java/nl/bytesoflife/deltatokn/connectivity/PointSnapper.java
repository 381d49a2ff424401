package nl.bytesoflife.deltatokn.connectivity;

import nl.bytesoflife.deltatokn.schematic.model.Point;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.quadtree.Quadtree;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns a node id to every point, reusing the id of an earlier point within tolerance. Ids are
 * handed out in first-seen order starting at 0.
 */
class PointSnapper {

    private record Node(int id, Point point) {}

    private final Quadtree tree = new Quadtree();
    private final List<Point> nodes = new ArrayList<>();
    private final double tolerance;

    PointSnapper(double tolerance) {
        this.tolerance = tolerance;
    }

    int snap(Point point) {
        Node existing = nearest(point);
        if (existing != null) {
            return existing.id();
        }
        int id = nodes.size();
        nodes.add(point);
        tree.insert(new Envelope(point.x(), point.x(), point.y(), point.y()), new Node(id, point));
        return id;
    }

    /**
     * Ids of every node within tolerance of {@code point}, in id order.
     */
    List<Integer> nodesNear(Point point) {
        List<Integer> ids = new ArrayList<>();
        for (Node node : candidates(point)) {
            if (node.point().isWithin(point, tolerance)) {
                ids.add(node.id());
            }
        }
        ids.sort(Integer::compare);
        return ids;
    }

    Point point(int id) {
        return nodes.get(id);
    }

    int size() {
        return nodes.size();
    }

    private Node nearest(Point point) {
        Node best = null;
        for (Node node : candidates(point)) {
            if (node.point().isWithin(point, tolerance) && (best == null || node.id() < best.id())) {
                best = node;
            }
        }
        return best;
    }

    @SuppressWarnings("unchecked")
    private List<Node> candidates(Point point) {
        Envelope search = new Envelope(point.x(), point.x(), point.y(), point.y());
        search.expandBy(tolerance);
        return (List<Node>) tree.query(search);
    }
}
