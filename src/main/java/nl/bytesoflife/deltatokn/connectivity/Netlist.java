package nl.bytesoflife.deltatokn.connectivity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The nets of one schematic, in natural name order.
 */
public class Netlist {

    private final List<Net> nets;

    Netlist(List<Net> nets) {
        List<Net> sorted = new ArrayList<>(nets);
        sorted.sort((a, b) -> NaturalOrder.INSTANCE.compare(a.getName(), b.getName()));
        this.nets = Collections.unmodifiableList(sorted);
    }

    public static Netlist empty() {
        return new Netlist(List.of());
    }

    public List<Net> nets() {
        return nets;
    }

    /**
     * The net called {@code name}, or null.
     */
    public Net net(String name) {
        for (Net net : nets) {
            if (net.getName().equals(name)) {
                return net;
            }
        }
        return null;
    }

    public int size() {
        return nets.size();
    }

    public boolean isEmpty() {
        return nets.isEmpty();
    }

    /**
     * Total number of pin memberships across all nets.
     */
    public int connectionCount() {
        return nets.stream().mapToInt(n -> n.getPins().size()).sum();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Netlist:\n");
        sb.append("  Nets: ").append(nets.size())
          .append(" (").append(connectionCount()).append(" connections)\n");
        for (Net net : nets) {
            sb.append("  - ").append(net).append("\n");
        }
        return sb.toString();
    }
}
