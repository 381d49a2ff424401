package nl.bytesoflife.deltatokn.schematic.parser;

import nl.bytesoflife.deltatokn.parser.SExpressionParser;
import nl.bytesoflife.deltatokn.parser.SNode;
import nl.bytesoflife.deltatokn.schematic.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link Schematic} from the S-expression tree of a KiCad 6+ {@code .kicad_sch} file.
 */
public class KicadSchParser {

    private static final Logger log = LoggerFactory.getLogger(KicadSchParser.class);

    static final String ROOT_TAG = "kicad_sch";

    // Sub-symbols are named <symbol>_<unit>_<bodyStyle>, e.g. "LM358_2_1"
    private static final Pattern SUB_SYMBOL_NAME = Pattern.compile(".*_(\\d+)_(\\d+)$");

    public Schematic parse(Path file) throws IOException {
        log.debug("Parsing schematic {}", file);
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Schematic schematic = parse(content);
        schematic.setFilename(file.getFileName().toString());
        return schematic;
    }

    public Schematic parse(String content) {
        SNode.SList root = new SExpressionParser().parseDocument(content);
        return build(root);
    }

    public Schematic build(SNode.SList root) {
        if (!ROOT_TAG.equals(root.tag())) {
            throw new SchemaException("Not a KiCad schematic: root tag is '" + root.tag() + "'");
        }

        Schematic schematic = new Schematic(parseTitle(root));

        SNode.SList libSymbols = root.child("lib_symbols");
        if (libSymbols != null) {
            for (SNode.SList symbol : libSymbols.children("symbol")) {
                LibSymbol libSymbol = parseLibSymbol(symbol);
                if (libSymbol != null) {
                    schematic.addLibSymbol(libSymbol);
                }
            }
        }

        Map<String, String> legacyReferences = parseLegacySymbolInstances(root);
        for (SNode.SList symbol : root.children("symbol")) {
            schematic.addComponent(parseComponent(symbol, schematic.getLibSymbols(), legacyReferences));
        }

        for (SNode.SList wire : root.children("wire")) {
            Wire parsed = parseWire(wire);
            if (parsed != null) {
                schematic.addWire(parsed);
            }
        }

        for (SNode.SList junction : root.children("junction")) {
            schematic.addJunction(new Junction(requirePoint(junction, "junction"), junction.valueString("uuid")));
        }

        // Labels keep document order across the three kinds
        for (SNode node : root.children()) {
            if (node instanceof SNode.SList list) {
                LabelType type = LabelType.fromKicadTag(list.tag());
                if (type != null) {
                    schematic.addLabel(parseLabel(list, type));
                }
            }
        }

        for (SNode.SList sheet : root.children("sheet")) {
            SheetReference reference = parseSheetReference(sheet);
            if (reference != null) {
                schematic.addSheetReference(reference);
            }
        }

        return schematic;
    }

    private String parseTitle(SNode.SList root) {
        SNode.SList titleBlock = root.child("title_block");
        if (titleBlock == null) return "";
        String title = titleBlock.valueString("title");
        return title != null ? title : "";
    }

    LibSymbol parseLibSymbol(SNode.SList symbol) {
        String libId = symbol.atomValue(1);
        if (libId == null) return null;

        boolean power = symbol.has("power");
        List<Pin> pins = new ArrayList<>();

        // Pins placed directly on the symbol are shared by every unit
        collectPins(symbol, 0, 0, pins);

        for (SNode.SList subSymbol : symbol.children("symbol")) {
            String name = subSymbol.atomValue(1);
            int unit = 0;
            int bodyStyle = 0;
            if (name != null) {
                Matcher m = SUB_SYMBOL_NAME.matcher(name);
                if (m.matches()) {
                    unit = Integer.parseInt(m.group(1));
                    bodyStyle = Integer.parseInt(m.group(2));
                }
            }
            collectPins(subSymbol, unit, bodyStyle, pins);
        }

        return new LibSymbol(libId, pins, power);
    }

    private void collectPins(SNode.SList parent, int unit, int bodyStyle, List<Pin> pins) {
        for (SNode.SList pinNode : parent.children("pin")) {
            Pin pin = parsePin(pinNode, unit, bodyStyle);
            if (pin != null) {
                pins.add(pin);
            }
        }
    }

    private Pin parsePin(SNode.SList pin, int unit, int bodyStyle) {
        // (pin passive line (at 0 3.81 270) (length 1.27) (name "~") (number "1"))
        String number = pin.valueString("number");
        SNode.SList at = pin.child("at");
        if (number == null || number.isEmpty() || at == null) {
            return null;
        }
        String name = pin.valueString("name");
        PinType type = PinType.fromKicadName(pin.atomValue(1));
        return new Pin(number, name != null ? name : "",
                at.doubleAt(1, 0), at.doubleAt(2, 0), at.doubleAt(3, 0),
                type, unit, bodyStyle);
    }

    private Component parseComponent(SNode.SList symbol, Map<String, LibSymbol> libSymbols,
                                     Map<String, String> legacyReferences) {
        String libId = symbol.valueString("lib_id");
        if (libId == null) {
            throw new SchemaException("Placed symbol without lib_id: " + abbreviate(symbol));
        }
        SNode.SList at = symbol.child("at");
        if (at == null || at.size() < 3) {
            throw new SchemaException("Placed symbol " + libId + " has no position");
        }

        Point position = new Point(at.doubleAt(1, 0), at.doubleAt(2, 0));
        double angle = at.doubleAt(3, 0);
        MirrorAxis mirror = MirrorAxis.fromKicadName(symbol.valueString("mirror"));
        int unit = intValue(symbol, "unit", 1);
        int bodyStyle = symbol.has("body_style") ? intValue(symbol, "body_style", 1) : intValue(symbol, "convert", 1);
        Placement placement = new Placement(position, angle, mirror, unit, bodyStyle);

        String uuid = symbol.valueString("uuid");
        boolean dnp = yesNo(symbol, "dnp", false);
        boolean inBom = yesNo(symbol, "in_bom", true);

        String reference = "";
        String value = "";
        String footprint = "";
        for (SNode.SList property : symbol.children("property")) {
            String key = property.atomValue(1);
            String propertyValue = property.atomValue(2);
            if (key == null || propertyValue == null) continue;
            switch (key) {
                case "Reference" -> reference = propertyValue;
                case "Value" -> value = propertyValue;
                case "Footprint" -> footprint = propertyValue;
                default -> { }
            }
        }
        if (reference.isEmpty() || reference.endsWith("?")) {
            reference = resolveAnnotatedReference(symbol, uuid, legacyReferences, reference);
        }

        String libName = symbol.valueString("lib_name");
        String lookupKey = libName != null && libSymbols.containsKey(libName) ? libName : libId;
        LibSymbol libSymbol = libSymbols.get(lookupKey);

        Map<String, Point> pins = new LinkedHashMap<>();
        if (libSymbol != null) {
            for (Pin pin : libSymbol.getPins(unit, bodyStyle)) {
                pins.putIfAbsent(pin.number(), PinTransform.apply(pin, placement));
            }
        } else {
            log.warn("No library symbol '{}' embedded for {}, its pins are unknown", lookupKey, reference);
        }

        return new Component(libId, libName, reference, value, footprint, placement, dnp, inBom, uuid,
                libSymbol, pins);
    }

    /**
     * Unannotated or multi-instance sheets keep the real designator in an instances block
     * ({@code (instances (project "x" (path "/..." (reference "R1"))))}) or, for KiCad 6 files,
     * in the root {@code symbol_instances} table.
     */
    private String resolveAnnotatedReference(SNode.SList symbol, String uuid, Map<String, String> legacyReferences,
                                             String fallback) {
        SNode.SList instances = symbol.child("instances");
        if (instances != null) {
            for (SNode.SList project : instances.children("project")) {
                for (SNode.SList path : project.children("path")) {
                    String reference = path.valueString("reference");
                    if (reference != null && !reference.isEmpty()) {
                        return reference;
                    }
                }
            }
        }
        if (uuid != null && legacyReferences.containsKey(uuid)) {
            return legacyReferences.get(uuid);
        }
        return fallback;
    }

    private Map<String, String> parseLegacySymbolInstances(SNode.SList root) {
        SNode.SList symbolInstances = root.child("symbol_instances");
        if (symbolInstances == null) return Map.of();

        Map<String, String> references = new HashMap<>();
        for (SNode.SList path : symbolInstances.children("path")) {
            String fullPath = path.atomValue(1);
            String reference = path.valueString("reference");
            if (fullPath == null || reference == null) continue;
            String uuid = fullPath.substring(fullPath.lastIndexOf('/') + 1);
            references.put(uuid, reference);
        }
        return references;
    }

    private Wire parseWire(SNode.SList wire) {
        SNode.SList pts = wire.child("pts");
        if (pts == null) return null;

        List<Point> points = new ArrayList<>();
        for (SNode.SList xy : pts.children("xy")) {
            if (xy.size() >= 3) {
                points.add(new Point(xy.doubleAt(1, 0), xy.doubleAt(2, 0)));
            }
        }
        if (points.size() < 2) {
            log.debug("Ignoring wire with {} point(s)", points.size());
            return null;
        }
        return new Wire(points, wire.valueString("uuid"));
    }

    private Label parseLabel(SNode.SList label, LabelType type) {
        String text = label.atomValue(1);
        if (text == null) {
            throw new SchemaException(type.getKicadTag() + " without text: " + abbreviate(label));
        }
        Point position = requirePoint(label, type.getKicadTag() + " '" + text + "'");
        double angle = label.child("at").doubleAt(3, 0);
        return new Label(text, position, angle, type, label.valueString("uuid"));
    }

    private SheetReference parseSheetReference(SNode.SList sheet) {
        String name = null;
        String filename = null;
        for (SNode.SList property : sheet.children("property")) {
            String key = property.atomValue(1);
            String value = property.atomValue(2);
            if (key == null) continue;
            switch (key) {
                case "Sheetname", "Sheet name" -> name = value;
                case "Sheetfile", "Sheet file" -> filename = value;
                default -> { }
            }
        }
        if (filename == null || filename.isBlank()) {
            log.debug("Ignoring sheet without a file property");
            return null;
        }
        return new SheetReference(name, filename, sheet.valueString("uuid"));
    }

    private Point requirePoint(SNode.SList node, String what) {
        SNode.SList at = node.child("at");
        if (at == null || at.size() < 3) {
            throw new SchemaException(what + " has no position");
        }
        return new Point(at.doubleAt(1, 0), at.doubleAt(2, 0));
    }

    private static int intValue(SNode.SList node, String tag, int fallback) {
        SNode.SAtom atom = node.value(tag);
        if (atom == null || !atom.isNumber()) return fallback;
        return (int) atom.asDouble();
    }

    private static boolean yesNo(SNode.SList node, String tag, boolean fallback) {
        SNode.SList child = node.child(tag);
        if (child == null) return fallback;
        String value = child.atomValue(1);
        // A bare (dnp) flag without a value counts as set
        return value == null || "yes".equals(value);
    }

    private static String abbreviate(SNode.SList node) {
        String text = node.toString();
        return text.length() > 80 ? text.substring(0, 77) + "..." : text;
    }
}
