package nl.bytesoflife.deltatokn.encoder;

import nl.bytesoflife.deltatokn.connectivity.ConnectivityAnalyzer;
import nl.bytesoflife.deltatokn.connectivity.NaturalOrder;
import nl.bytesoflife.deltatokn.connectivity.Netlist;
import nl.bytesoflife.deltatokn.schematic.model.Component;
import nl.bytesoflife.deltatokn.schematic.model.Pin;
import nl.bytesoflife.deltatokn.schematic.model.Schematic;
import nl.bytesoflife.deltatokn.schematic.model.SheetEntry;

import java.util.*;

/**
 * Everything an encoder writes for one sheet, in output order.
 */
record SheetContent(String path, String title, List<ComponentRow> components, Netlist netlist,
                    SortedMap<String, SortedMap<String, String>> pinNames) {

    /**
     * Uses the sheet's netlist from {@code netlists} when present, otherwise analyzes the sheet.
     */
    static SheetContent of(SheetEntry sheet, Map<String, Netlist> netlists, ConnectivityAnalyzer analyzer) {
        Netlist netlist = netlists.get(sheet.path());
        if (netlist == null) {
            netlist = analyzer.analyze(sheet.schematic());
        }
        return of(sheet.path(), sheet.schematic(), netlist);
    }

    static SheetContent of(String path, Schematic schematic, Netlist netlist) {
        Map<String, ComponentRow> rows = new HashMap<>();
        SortedMap<String, SortedMap<String, String>> pinNames = new TreeMap<>(NaturalOrder.INSTANCE);

        for (Component component : schematic.getComponents()) {
            String reference = component.getReference();
            rows.putIfAbsent(reference, new ComponentRow(reference,
                    Vocabulary.normalizeType(component.getLibId()),
                    Vocabulary.normalizeValue(component.getValue()),
                    Vocabulary.normalizeFootprint(component.getFootprint()),
                    component.getLibId(),
                    component.isDnp()));

            if (component.getLibSymbol() == null) continue;
            List<Pin> pins = component.getLibSymbol().getPins(component.getUnit(),
                    component.getPlacement().bodyStyle());
            for (Pin pin : pins) {
                if (pin.hasMeaningfulName()) {
                    pinNames.computeIfAbsent(reference, k -> new TreeMap<>(NaturalOrder.INSTANCE))
                            .putIfAbsent(pin.number(), pin.name());
                }
            }
        }

        List<ComponentRow> sorted = new ArrayList<>(rows.values());
        sorted.sort(Comparator.comparing(ComponentRow::reference, NaturalOrder.INSTANCE));

        return new SheetContent(path, schematic.getTitle(), sorted, netlist, pinNames);
    }

    List<String> dnpReferences() {
        return components.stream()
                .filter(ComponentRow::dnp)
                .map(ComponentRow::reference)
                .toList();
    }
}
