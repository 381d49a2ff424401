package nl.bytesoflife.deltatokn.encoder;

import nl.bytesoflife.deltatokn.connectivity.ConnectivityAnalyzer;
import nl.bytesoflife.deltatokn.connectivity.ConnectivitySettings;
import nl.bytesoflife.deltatokn.connectivity.Net;
import nl.bytesoflife.deltatokn.connectivity.Netlist;
import nl.bytesoflife.deltatokn.connectivity.PinRef;
import nl.bytesoflife.deltatokn.schematic.model.HierarchicalSchematic;
import nl.bytesoflife.deltatokn.schematic.model.Schematic;
import nl.bytesoflife.deltatokn.schematic.model.SheetEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a component table and a net table per sheet.
 */
public final class MarkdownEncoder implements NotationEncoder {

    private final ConnectivityAnalyzer analyzer;

    public MarkdownEncoder() {
        this(ConnectivitySettings.defaults());
    }

    public MarkdownEncoder(ConnectivitySettings settings) {
        this.analyzer = new ConnectivityAnalyzer(settings);
    }

    @Override
    public String encode(HierarchicalSchematic hierarchy) {
        return encode(hierarchy, analyzer.analyze(hierarchy));
    }

    @Override
    public String encode(HierarchicalSchematic hierarchy, Map<String, Netlist> netlists) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(cell(hierarchy.getProjectName())).append("\n");
        for (SheetEntry sheet : hierarchy.getSheets()) {
            SheetContent content = SheetContent.of(sheet, netlists, analyzer);
            sb.append("\n## ").append(cell(content.path())).append("\n");
            if (!content.title().isEmpty()) {
                sb.append("\n").append(cell(content.title())).append("\n");
            }
            appendTables(content, sb);
        }
        return sb.toString();
    }

    @Override
    public String encodeSheet(Schematic schematic) {
        StringBuilder sb = new StringBuilder();
        appendTables(SheetContent.of(schematic.getFilename(), schematic, analyzer.analyze(schematic)), sb);
        return sb.toString();
    }

    private void appendTables(SheetContent content, StringBuilder sb) {
        sb.append("\n### Components\n\n");
        sb.append("| Reference | Type | Value | Footprint |\n");
        sb.append("|-----------|------|-------|-----------|\n");
        for (ComponentRow row : content.components()) {
            sb.append("| ").append(cell(row.reference()))
              .append(" | ").append(cell(row.type()))
              .append(" | ").append(cell(row.value()))
              .append(" | ").append(cell(row.footprint()))
              .append(" |\n");
        }

        sb.append("\n### Nets\n\n");
        sb.append("| Net | Pins |\n");
        sb.append("|-----|------|\n");
        for (Net net : content.netlist().nets()) {
            List<String> pins = new ArrayList<>();
            for (PinRef pin : net.getPins()) {
                pins.add(cell(pin.toString()));
            }
            sb.append("| ").append(cell(net.getName()))
              .append(" | ").append(String.join(", ", pins))
              .append(" |\n");
        }
    }

    private static String cell(String text) {
        if (text == null) return "";
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
