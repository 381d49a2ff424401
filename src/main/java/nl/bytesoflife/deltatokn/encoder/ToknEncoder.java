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
import java.util.SortedMap;

/**
 * Writes the TOKN notation:
 * <pre>
 * # TOKN v1
 * project: amp
 * sheets: 1
 *
 * # sheet: amp
 *
 * components[2]{ref,type,value,fp}:
 *   R1,R,10k,0603
 *   R2,R,10k,0603
 * nets[2]{name,pins}:
 *   GND,R2.2
 *   VCC,R1.2 R2.1
 * </pre>
 * A {@code pins} section follows for parts with named pins, and a {@code dnp} line when any
 * part is not populated.
 */
public final class ToknEncoder implements NotationEncoder {

    public static final String VERSION = "v1";

    private static final String INDENT = "  ";

    private final ConnectivityAnalyzer analyzer;

    public ToknEncoder() {
        this(ConnectivitySettings.defaults());
    }

    public ToknEncoder(ConnectivitySettings settings) {
        this.analyzer = new ConnectivityAnalyzer(settings);
    }

    @Override
    public String encode(HierarchicalSchematic hierarchy) {
        return encode(hierarchy, analyzer.analyze(hierarchy));
    }

    @Override
    public String encode(HierarchicalSchematic hierarchy, Map<String, Netlist> netlists) {
        List<String> lines = new ArrayList<>();
        lines.add("# TOKN " + VERSION);
        lines.add("project: " + headerValue(hierarchy.getProjectName()));
        lines.add("sheets: " + hierarchy.getSheets().size());
        lines.add("");

        for (SheetEntry sheet : hierarchy.getSheets()) {
            SheetContent content = SheetContent.of(sheet, netlists, analyzer);
            lines.add("# sheet: " + headerValue(content.path()));
            if (!content.title().isEmpty()) {
                lines.add("# title: " + headerValue(content.title()));
            }
            lines.add("");
            appendBody(content, lines);
            lines.add("");
        }
        return String.join("\n", lines);
    }

    @Override
    public String encodeSheet(Schematic schematic) {
        List<String> lines = new ArrayList<>();
        appendBody(SheetContent.of(schematic.getFilename(), schematic, analyzer.analyze(schematic)), lines);
        lines.add("");
        return String.join("\n", lines);
    }

    private void appendBody(SheetContent content, List<String> lines) {
        lines.add("components[" + content.components().size() + "]{ref,type,value,fp}:");
        for (ComponentRow row : content.components()) {
            lines.add(INDENT + String.join(",",
                    field(row.reference()), field(row.type()), field(row.value()), field(row.footprint())));
        }

        List<Net> nets = content.netlist().nets();
        lines.add("nets[" + nets.size() + "]{name,pins}:");
        for (Net net : nets) {
            List<String> members = new ArrayList<>();
            for (PinRef pin : net.getPins()) {
                members.add(field(pin.toString()));
            }
            lines.add(INDENT + field(net.getName()) + "," + String.join(" ", members));
        }

        SortedMap<String, SortedMap<String, String>> pinNames = content.pinNames();
        if (!pinNames.isEmpty()) {
            lines.add("pins[" + pinNames.size() + "]{ref,map}:");
            for (Map.Entry<String, SortedMap<String, String>> entry : pinNames.entrySet()) {
                List<String> pairs = new ArrayList<>();
                for (Map.Entry<String, String> pin : entry.getValue().entrySet()) {
                    pairs.add(field(pin.getKey() + "=" + pin.getValue()));
                }
                lines.add(INDENT + field(entry.getKey()) + "," + String.join(" ", pairs));
            }
        }

        List<String> dnp = content.dnpReferences();
        if (!dnp.isEmpty()) {
            List<String> refs = new ArrayList<>();
            for (String ref : dnp) {
                refs.add(field(ref));
            }
            lines.add("dnp[" + dnp.size() + "]: " + String.join(" ", refs));
        }
    }

    /**
     * Header values run to the end of their line, so line breaks inside them become spaces.
     */
    static String headerValue(String value) {
        if (value == null) return "";
        return value.replaceAll("\\R", " ");
    }

    /**
     * Quotes a field that would otherwise be split by the reader.
     */
    static String field(String value) {
        if (value == null) return "";
        boolean quote = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ',' || c == '"' || Character.isWhitespace(c)) {
                quote = true;
                break;
            }
        }
        if (!quote) return value;
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
