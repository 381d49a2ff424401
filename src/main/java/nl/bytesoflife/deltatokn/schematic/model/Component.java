package nl.bytesoflife.deltatokn.schematic.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A placed symbol instance. The pin map is derived from the bound library symbol once, when the
 * component is built, and cannot be changed afterwards.
 */
public class Component {

    private final String libId;
    private final String libName;
    private final String reference;
    private final String value;
    private final String footprint;
    private final Placement placement;
    private final boolean dnp;
    private final boolean inBom;
    private final String uuid;
    private final LibSymbol libSymbol;
    private final Map<String, Point> pins;

    public Component(String libId, String libName, String reference, String value, String footprint,
                     Placement placement, boolean dnp, boolean inBom, String uuid,
                     LibSymbol libSymbol, Map<String, Point> pins) {
        this.libId = libId;
        this.libName = libName;
        this.reference = reference;
        this.value = value;
        this.footprint = footprint;
        this.placement = placement;
        this.dnp = dnp;
        this.inBom = inBom;
        this.uuid = uuid;
        this.libSymbol = libSymbol;
        this.pins = Collections.unmodifiableMap(new LinkedHashMap<>(pins));
    }

    public String getLibId() { return libId; }
    public String getLibName() { return libName; }
    public String getReference() { return reference; }
    public String getValue() { return value; }
    public String getFootprint() { return footprint; }
    public Placement getPlacement() { return placement; }
    public Point getPosition() { return placement.position(); }
    public double getAngle() { return placement.angle(); }
    public MirrorAxis getMirror() { return placement.mirror(); }
    public int getUnit() { return placement.unit(); }
    public boolean isDnp() { return dnp; }
    public boolean isInBom() { return inBom; }
    public String getUuid() { return uuid; }

    /**
     * The library symbol this instance is bound to, or null when the schematic did not embed it.
     */
    public LibSymbol getLibSymbol() { return libSymbol; }

    /**
     * Absolute pin positions keyed by pin number, restricted to the placed unit.
     */
    public Map<String, Point> getPins() { return pins; }

    public boolean isPowerSymbol() {
        return libSymbol != null && libSymbol.isPower();
    }

    @Override
    public String toString() {
        return "Component{" + reference + " " + libId + " '" + value + "' at " + placement.position()
                + ", pins=" + pins.size() + "}";
    }
}
