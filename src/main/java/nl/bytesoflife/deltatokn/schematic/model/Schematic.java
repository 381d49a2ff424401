package nl.bytesoflife.deltatokn.schematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One schematic sheet.
 */
public class Schematic {

    private String title;
    private String filename = "";
    private final Map<String, LibSymbol> libSymbols = new LinkedHashMap<>();
    private final List<Component> components = new ArrayList<>();
    private final List<Wire> wires = new ArrayList<>();
    private final List<Junction> junctions = new ArrayList<>();
    private final List<Label> labels = new ArrayList<>();
    private final List<SheetReference> sheetReferences = new ArrayList<>();

    public Schematic(String title) {
        this.title = title != null ? title : "";
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title != null ? title : "";
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public Map<String, LibSymbol> getLibSymbols() {
        return Collections.unmodifiableMap(libSymbols);
    }

    public void addLibSymbol(LibSymbol symbol) {
        libSymbols.put(symbol.getLibId(), symbol);
    }

    public List<Component> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public void addComponent(Component component) {
        components.add(component);
    }

    public List<Wire> getWires() {
        return Collections.unmodifiableList(wires);
    }

    public void addWire(Wire wire) {
        wires.add(wire);
    }

    public List<Junction> getJunctions() {
        return Collections.unmodifiableList(junctions);
    }

    public void addJunction(Junction junction) {
        junctions.add(junction);
    }

    public List<Label> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    public void addLabel(Label label) {
        labels.add(label);
    }

    public List<SheetReference> getSheetReferences() {
        return Collections.unmodifiableList(sheetReferences);
    }

    public void addSheetReference(SheetReference reference) {
        sheetReferences.add(reference);
    }

    public boolean isEmpty() {
        return components.isEmpty() && wires.isEmpty() && labels.isEmpty();
    }

    @Override
    public String toString() {
        return "Schematic{title='" + title + "', components=" + components.size() + ", wires=" + wires.size()
                + ", junctions=" + junctions.size() + ", labels=" + labels.size() + "}";
    }
}
