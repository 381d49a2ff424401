package nl.bytesoflife.deltatokn.connectivity;

import nl.bytesoflife.deltatokn.schematic.model.Point;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A set of electrically joined pins together with the wire points that joined them.
 */
public class Net {

    private final String name;
    private final boolean defaultName;
    private final SortedSet<PinRef> pins = new TreeSet<>();
    private final Set<Point> points = new LinkedHashSet<>();

    Net(String name, boolean defaultName) {
        this.name = name;
        this.defaultName = defaultName;
    }

    void addPin(PinRef pin) {
        pins.add(pin);
    }

    void addPoints(Set<Point> morePoints) {
        points.addAll(morePoints);
    }

    public String getName() {
        return name;
    }

    /**
     * True when no label or power symbol named this net and it carries a {@code Net_<n>} name.
     */
    public boolean hasDefaultName() {
        return defaultName;
    }

    /**
     * Member pins ordered by reference, then pin number.
     */
    public SortedSet<PinRef> getPins() {
        return Collections.unmodifiableSortedSet(pins);
    }

    public Set<Point> getPoints() {
        return Collections.unmodifiableSet(points);
    }

    public boolean contains(String reference, String pin) {
        return pins.contains(new PinRef(reference, pin));
    }

    @Override
    public String toString() {
        return "Net{" + name + " " + pins + "}";
    }
}
