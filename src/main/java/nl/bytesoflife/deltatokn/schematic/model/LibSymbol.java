package nl.bytesoflife.deltatokn.schematic.model;

import java.util.List;

/**
 * A symbol definition from the {@code lib_symbols} section. Shared by every placed instance
 * with the same library id.
 */
public class LibSymbol {

    private final String libId;
    private final List<Pin> pins;
    private final boolean power;

    public LibSymbol(String libId, List<Pin> pins, boolean power) {
        this.libId = libId;
        this.pins = List.copyOf(pins);
        this.power = power;
    }

    public String getLibId() {
        return libId;
    }

    public List<Pin> getPins() {
        return pins;
    }

    public boolean isPower() {
        return power;
    }

    /**
     * Pins that are present on the given unit and body style.
     */
    public List<Pin> getPins(int unit, int bodyStyle) {
        return pins.stream()
                .filter(p -> p.belongsTo(unit, bodyStyle))
                .toList();
    }

    public int getUnitCount() {
        return (int) pins.stream().mapToInt(Pin::unit).filter(u -> u > 0).distinct().count();
    }

    @Override
    public String toString() {
        return "LibSymbol{libId='" + libId + "', pins=" + pins.size() + (power ? ", power" : "") + "}";
    }
}
