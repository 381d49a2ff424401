package nl.bytesoflife.deltatokn.encoder;

import nl.bytesoflife.deltatokn.connectivity.ConnectivityAnalyzer;
import nl.bytesoflife.deltatokn.connectivity.ConnectivitySettings;
import nl.bytesoflife.deltatokn.connectivity.Net;
import nl.bytesoflife.deltatokn.connectivity.Netlist;
import nl.bytesoflife.deltatokn.connectivity.PinRef;
import nl.bytesoflife.deltatokn.schematic.model.HierarchicalSchematic;
import nl.bytesoflife.deltatokn.schematic.model.Schematic;
import nl.bytesoflife.deltatokn.schematic.model.SheetEntry;

import java.util.Map;

/**
 * Writes a single-line JSON document:
 * {@code {"project":..,"sheets":[{"path":..,"title":..,"components":[..],"nets":[..]}]}}.
 */
public final class JsonEncoder implements NotationEncoder {

    private final ConnectivityAnalyzer analyzer;

    public JsonEncoder() {
        this(ConnectivitySettings.defaults());
    }

    public JsonEncoder(ConnectivitySettings settings) {
        this.analyzer = new ConnectivityAnalyzer(settings);
    }

    @Override
    public String encode(HierarchicalSchematic hierarchy) {
        return encode(hierarchy, analyzer.analyze(hierarchy));
    }

    @Override
    public String encode(HierarchicalSchematic hierarchy, Map<String, Netlist> netlists) {
        StringBuilder json = new StringBuilder();
        json.append("{\"project\":").append(escapeJson(hierarchy.getProjectName()));
        json.append(",\"sheets\":[");
        boolean first = true;
        for (SheetEntry sheet : hierarchy.getSheets()) {
            if (!first) json.append(",");
            first = false;
            appendSheet(SheetContent.of(sheet, netlists, analyzer), json);
        }
        json.append("]}");
        return json.toString();
    }

    @Override
    public String encodeSheet(Schematic schematic) {
        StringBuilder json = new StringBuilder();
        appendSheet(SheetContent.of(schematic.getFilename(), schematic, analyzer.analyze(schematic)), json);
        return json.toString();
    }

    private void appendSheet(SheetContent content, StringBuilder json) {
        json.append("{\"path\":").append(escapeJson(content.path()));
        json.append(",\"title\":").append(escapeJson(content.title()));

        json.append(",\"components\":[");
        boolean first = true;
        for (ComponentRow row : content.components()) {
            if (!first) json.append(",");
            first = false;
            json.append("{\"ref\":").append(escapeJson(row.reference()));
            json.append(",\"type\":").append(escapeJson(row.type()));
            json.append(",\"value\":").append(escapeJson(row.value()));
            json.append(",\"footprint\":").append(escapeJson(row.footprint()));
            json.append(",\"libId\":").append(escapeJson(row.libId()));
            json.append(",\"dnp\":").append(row.dnp());
            json.append("}");
        }

        json.append("],\"nets\":[");
        first = true;
        for (Net net : content.netlist().nets()) {
            if (!first) json.append(",");
            first = false;
            json.append("{\"name\":").append(escapeJson(net.getName()));
            json.append(",\"pins\":[");
            boolean firstPin = true;
            for (PinRef pin : net.getPins()) {
                if (!firstPin) json.append(",");
                firstPin = false;
                json.append(escapeJson(pin.toString()));
            }
            json.append("]}");
        }
        json.append("]}");
    }

    static String escapeJson(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append("\"");
        return sb.toString();
    }
}
