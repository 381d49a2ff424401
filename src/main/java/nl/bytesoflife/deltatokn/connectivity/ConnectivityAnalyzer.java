package nl.bytesoflife.deltatokn.connectivity;

import nl.bytesoflife.deltatokn.schematic.model.Component;
import nl.bytesoflife.deltatokn.schematic.model.HierarchicalSchematic;
import nl.bytesoflife.deltatokn.schematic.model.Junction;
import nl.bytesoflife.deltatokn.schematic.model.Label;
import nl.bytesoflife.deltatokn.schematic.model.Point;
import nl.bytesoflife.deltatokn.schematic.model.Schematic;
import nl.bytesoflife.deltatokn.schematic.model.SheetEntry;
import nl.bytesoflife.deltatokn.schematic.model.Wire;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Derives nets from the wires, junctions, labels and pin positions of a schematic.
 * <p>
 * Wire points closer than the tight tolerance are one node. Consecutive points of a wire are
 * joined, and so are all nodes under a junction. Each connected group of nodes is a candidate
 * net, numbered in the order its first point was seen. Labels and pins join a net when they lie
 * within the loose tolerance of one of its points. Unnamed nets without pins are dropped, and a
 * default name already used by a label moves on to the next free number.
 */
public class ConnectivityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityAnalyzer.class);

    static final String DEFAULT_NET_PREFIX = "Net_";

    private final ConnectivitySettings settings;

    public ConnectivityAnalyzer() {
        this(ConnectivitySettings.defaults());
    }

    public ConnectivityAnalyzer(ConnectivitySettings settings) {
        this.settings = settings;
    }

    public ConnectivitySettings getSettings() {
        return settings;
    }

    /**
     * Analyzes every sheet separately. The result is keyed by hierarchical path, in sheet order.
     */
    public Map<String, Netlist> analyze(HierarchicalSchematic hierarchy) {
        Map<String, Netlist> result = new LinkedHashMap<>();
        for (SheetEntry sheet : hierarchy.getSheets()) {
            result.put(sheet.path(), analyze(sheet.schematic()));
        }
        return result;
    }

    public Netlist analyze(Schematic schematic) {
        List<Set<Point>> groups = groupWirePoints(schematic);

        List<String> names = new ArrayList<>(groups.size());
        List<Set<PinRef>> members = new ArrayList<>(groups.size());
        Set<String> taken = new HashSet<>();
        for (Set<Point> group : groups) {
            PointIndex index = new PointIndex(group);

            String name = nameFromLabels(schematic.getLabels(), index);
            if (name == null && settings.isPowerSymbolNaming()) {
                name = nameFromPowerSymbols(schematic.getComponents(), index);
            }
            names.add(name);
            members.add(pinsNear(schematic.getComponents(), index));
            if (name != null) {
                taken.add(name);
            }
        }

        List<Net> retained = new ArrayList<>();
        Map<String, Net> named = new HashMap<>();
        for (int i = 0; i < groups.size(); i++) {
            String name = names.get(i);
            Set<PinRef> pins = members.get(i);
            if (name == null) {
                if (pins.isEmpty()) {
                    continue;
                }
                Net net = new Net(freeDefaultName(i + 1, taken), true);
                taken.add(net.getName());
                fill(net, groups.get(i), pins);
                retained.add(net);
                continue;
            }

            // Equal label text on separate wire groups is one net
            Net existing = named.get(name);
            if (existing != null) {
                fill(existing, groups.get(i), pins);
            } else {
                Net net = new Net(name, false);
                fill(net, groups.get(i), pins);
                named.put(name, net);
                retained.add(net);
            }
        }

        log.debug("{}: {} wire group(s), {} net(s)", describe(schematic), groups.size(), retained.size());
        return new Netlist(retained);
    }

    /**
     * {@code Net_<number>}, or the next free number when a label already uses that name.
     */
    private static String freeDefaultName(int number, Set<String> taken) {
        int n = number;
        while (taken.contains(DEFAULT_NET_PREFIX + n)) {
            n++;
        }
        return DEFAULT_NET_PREFIX + n;
    }

    private static void fill(Net net, Set<Point> points, Set<PinRef> pins) {
        net.addPoints(points);
        for (PinRef pin : pins) {
            net.addPin(pin);
        }
    }

    private Set<PinRef> pinsNear(List<Component> components, PointIndex index) {
        Set<PinRef> pins = new LinkedHashSet<>();
        for (Component component : components) {
            for (Map.Entry<String, Point> pin : component.getPins().entrySet()) {
                if (index.anyWithin(pin.getValue(), settings.getLooseTolerance())) {
                    pins.add(new PinRef(component.getReference(), pin.getKey()));
                }
            }
        }
        return pins;
    }

    /**
     * Snaps wire points into nodes, joins them along wires and under junctions and returns the
     * connected groups in discovery order.
     */
    private List<Set<Point>> groupWirePoints(Schematic schematic) {
        PointSnapper snapper = new PointSnapper(settings.getTightTolerance());
        UnionFind sets = new UnionFind();

        for (Wire wire : schematic.getWires()) {
            int previous = -1;
            for (Point point : wire.points()) {
                int node = snapper.snap(point);
                sets.ensure(node);
                if (previous >= 0) {
                    sets.union(previous, node);
                }
                previous = node;
            }
        }

        for (Junction junction : schematic.getJunctions()) {
            List<Integer> nodes = snapper.nodesNear(junction.position());
            for (int k = 1; k < nodes.size(); k++) {
                sets.union(nodes.get(0), nodes.get(k));
            }
        }

        Map<Integer, Set<Point>> groups = new LinkedHashMap<>();
        for (int node = 0; node < snapper.size(); node++) {
            groups.computeIfAbsent(sets.find(node), k -> new LinkedHashSet<>()).add(snapper.point(node));
        }
        return new ArrayList<>(groups.values());
    }

    private String nameFromLabels(List<Label> labels, PointIndex index) {
        List<String> candidates = new ArrayList<>();
        for (Label label : labels) {
            if (index.anyWithin(label.position(), settings.getLooseTolerance())) {
                candidates.add(label.text());
            }
        }
        return pick(candidates);
    }

    private String nameFromPowerSymbols(List<Component> components, PointIndex index) {
        List<String> candidates = new ArrayList<>();
        for (Component component : components) {
            if (!component.isPowerSymbol() || component.getValue().isEmpty()) continue;
            for (Point pin : component.getPins().values()) {
                if (index.anyWithin(pin, settings.getLooseTolerance())) {
                    candidates.add(component.getValue());
                    break;
                }
            }
        }
        return pick(candidates);
    }

    private String pick(List<String> candidates) {
        if (candidates.isEmpty()) return null;
        return switch (settings.getLabelPolicy()) {
            case FIRST_IN_PARSE_ORDER -> candidates.get(0);
            case LEXICOGRAPHIC -> Collections.min(candidates);
        };
    }

    private static String describe(Schematic schematic) {
        String filename = schematic.getFilename();
        return filename == null || filename.isEmpty() ? "schematic" : filename;
    }
}
