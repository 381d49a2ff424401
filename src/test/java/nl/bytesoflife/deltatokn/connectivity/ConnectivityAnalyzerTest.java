package nl.bytesoflife.deltatokn.connectivity;

import nl.bytesoflife.deltatokn.Fixtures;
import nl.bytesoflife.deltatokn.schematic.model.*;
import nl.bytesoflife.deltatokn.schematic.parser.KicadSchParser;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConnectivityAnalyzerTest {

    private final ConnectivityAnalyzer analyzer = new ConnectivityAnalyzer();

    private static Wire wire(double x1, double y1, double x2, double y2) {
        return new Wire(List.of(new Point(x1, y1), new Point(x2, y2)), null);
    }

    private static Label label(String text, double x, double y) {
        return new Label(text, new Point(x, y), 0, LabelType.LOCAL, null);
    }

    private static Component component(String reference, String value, LibSymbol symbol, Map<String, Point> pins) {
        Placement placement = new Placement(new Point(0, 0), 0, MirrorAxis.NONE, 1, 1);
        return new Component(symbol != null ? symbol.getLibId() : "Device:R", null, reference, value, "",
                placement, false, true, null, symbol, pins);
    }

    private static Component part(String reference, String pin, double x, double y) {
        return component(reference, "", null, Map.of(pin, new Point(x, y)));
    }

    private static Component powerSymbol(String reference, String value, double x, double y) {
        Pin pin = new Pin("1", value, 0, 0, 0, PinType.POWER_IN, 1, 1);
        LibSymbol symbol = new LibSymbol("power:" + value, List.of(pin), true);
        return component(reference, value, symbol, Map.of("1", new Point(x, y)));
    }

    private static Set<PinRef> pins(Net net) {
        return Set.copyOf(net.getPins());
    }

    /**
     * Three wires whose inner ends are pairwise further apart than the tight tolerance but each
     * within it of the origin.
     */
    private static Schematic star(boolean withJunction) {
        Schematic schematic = new Schematic("star");
        schematic.addWire(wire(0.009, 0.009, 10, 10));
        schematic.addWire(wire(-0.009, -0.009, -10, -10));
        schematic.addWire(wire(0.009, -0.009, 10, -10));
        if (withJunction) {
            schematic.addJunction(new Junction(new Point(0, 0), null));
        }
        schematic.addComponent(part("R1", "1", 10, 10));
        schematic.addComponent(part("R2", "1", -10, -10));
        schematic.addComponent(part("R3", "1", 10, -10));
        return schematic;
    }

    @Test
    void junctionFusesWiresMeetingAtIt() {
        Netlist netlist = analyzer.analyze(star(true));

        assertEquals(1, netlist.size());
        assertEquals(Set.of(new PinRef("R1", "1"), new PinRef("R2", "1"), new PinRef("R3", "1")),
                pins(netlist.nets().get(0)));
    }

    @Test
    void withoutJunctionWiresStaySeparate() {
        Netlist netlist = analyzer.analyze(star(false));

        assertEquals(3, netlist.size());
        assertEquals(List.of("Net_1", "Net_2", "Net_3"), netlist.nets().stream().map(Net::getName).toList());
    }

    @Test
    void dividerHasTwoNamedNets() {
        Schematic schematic = new KicadSchParser().parse(Fixtures.divider());
        Netlist netlist = analyzer.analyze(schematic);

        assertEquals(2, netlist.size());
        assertEquals(Set.of(new PinRef("R1", "2"), new PinRef("R2", "1")), pins(netlist.net("VCC")));
        assertEquals(Set.of(new PinRef("R2", "2")), pins(netlist.net("GND")));
        assertEquals(3, netlist.connectionCount());
    }

    @Test
    void everyMemberPinTouchesTheNet() {
        Schematic schematic = new KicadSchParser().parse(Fixtures.divider());
        Map<String, Component> byRef = new HashMap<>();
        schematic.getComponents().forEach(c -> byRef.put(c.getReference(), c));

        for (Net net : analyzer.analyze(schematic).nets()) {
            PointIndex index = new PointIndex(net.getPoints());
            for (PinRef pin : net.getPins()) {
                Point position = byRef.get(pin.reference()).getPins().get(pin.pin());
                assertTrue(index.anyWithin(position, ConnectivitySettings.DEFAULT_LOOSE_TOLERANCE), pin.toString());
            }
        }
    }

    @Test
    void lexicographicLabelWinsByDefault() {
        Schematic schematic = new Schematic("labels");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addLabel(label("ZETA", 0, 0));
        schematic.addLabel(label("ALPHA", 10, 0));
        schematic.addComponent(part("R1", "1", 0, 0));

        assertNotNull(analyzer.analyze(schematic).net("ALPHA"));

        ConnectivityAnalyzer firstMatch = new ConnectivityAnalyzer(ConnectivitySettings.defaults()
                .withLabelPolicy(ConnectivitySettings.LabelPolicy.FIRST_IN_PARSE_ORDER));
        Netlist netlist = firstMatch.analyze(schematic);
        assertEquals(1, netlist.size());
        assertNotNull(netlist.net("ZETA"));
    }

    @Test
    void labelWithinLooseToleranceNamesNet() {
        Schematic schematic = new Schematic("offset");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addLabel(label("CLK", 11.5, 0.5));
        schematic.addLabel(label("FAR", 20, 0));

        Netlist netlist = analyzer.analyze(schematic);
        assertEquals(1, netlist.size());
        assertEquals("CLK", netlist.nets().get(0).getName());
        assertTrue(netlist.nets().get(0).getPins().isEmpty());
    }

    @Test
    void unnamedNetWithoutPinsIsDropped() {
        Schematic schematic = new Schematic("dangling");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addWire(wire(50, 0, 60, 0));
        schematic.addComponent(part("R1", "2", 60, 0));

        Netlist netlist = analyzer.analyze(schematic);
        assertEquals(1, netlist.size());
        // numbered in discovery order, the dropped group keeps its number
        assertEquals("Net_2", netlist.nets().get(0).getName());
        assertTrue(netlist.nets().get(0).hasDefaultName());
    }

    @Test
    void powerSymbolsDoNotNameNetsByDefault() {
        Schematic schematic = new Schematic("power");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addComponent(powerSymbol("#PWR01", "GND", 0, 0));
        schematic.addComponent(part("R1", "2", 10, 0));

        Netlist netlist = analyzer.analyze(schematic);
        assertEquals(1, netlist.size());
        Net net = netlist.net("Net_1");
        assertNotNull(net);
        assertTrue(net.hasDefaultName());
        assertEquals(Set.of(new PinRef("#PWR01", "1"), new PinRef("R1", "2")), pins(net));
    }

    @Test
    void powerSymbolNamesUnlabelledNetWhenEnabled() {
        Schematic schematic = new Schematic("power");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addComponent(powerSymbol("#PWR01", "+3V3", 0, 0));
        schematic.addComponent(part("U1", "8", 10, 0));

        ConnectivityAnalyzer powerNames = new ConnectivityAnalyzer(
                ConnectivitySettings.defaults().withPowerSymbolNaming(true));
        Net net = powerNames.analyze(schematic).net("+3V3");
        assertNotNull(net);
        assertFalse(net.hasDefaultName());
        assertEquals(Set.of(new PinRef("#PWR01", "1"), new PinRef("U1", "8")), pins(net));
    }

    @Test
    void labelBeatsPowerSymbol() {
        Schematic schematic = new Schematic("power");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addComponent(powerSymbol("#PWR01", "+3V3", 0, 0));
        schematic.addLabel(label("VDD", 10, 0));

        ConnectivityAnalyzer powerNames = new ConnectivityAnalyzer(
                ConnectivitySettings.defaults().withPowerSymbolNaming(true));
        assertNotNull(powerNames.analyze(schematic).net("VDD"));
    }

    @Test
    void labelShapedLikeDefaultNameDoesNotJoinUnlabelledNet() {
        Schematic schematic = new Schematic("clash");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addLabel(label("Net_2", 10, 0));
        schematic.addComponent(part("R1", "1", 0, 0));
        schematic.addWire(wire(100, 0, 110, 0));
        schematic.addComponent(part("R2", "1", 100, 0));

        Netlist netlist = analyzer.analyze(schematic);

        assertEquals(2, netlist.size());
        assertEquals(Set.of(new PinRef("R1", "1")), pins(netlist.net("Net_2")));
        assertFalse(netlist.net("Net_2").hasDefaultName());
        assertEquals(Set.of(new PinRef("R2", "1")), pins(netlist.net("Net_3")));
        assertTrue(netlist.net("Net_3").hasDefaultName());
    }

    @Test
    void defaultNamesStayUniqueAfterRenumbering() {
        Schematic schematic = new Schematic("clash");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addComponent(part("R1", "1", 0, 0));
        schematic.addWire(wire(50, 0, 60, 0));
        schematic.addLabel(label("Net_1", 60, 0));
        schematic.addWire(wire(100, 0, 110, 0));
        schematic.addComponent(part("R3", "1", 100, 0));

        Netlist netlist = analyzer.analyze(schematic);

        assertEquals(List.of("Net_1", "Net_2", "Net_3"), netlist.nets().stream().map(Net::getName).toList());
        assertEquals(Set.of(new PinRef("R1", "1")), pins(netlist.net("Net_2")));
        assertEquals(Set.of(new PinRef("R3", "1")), pins(netlist.net("Net_3")));
        assertTrue(netlist.net("Net_1").getPins().isEmpty());
    }

    @Test
    void sameLabelOnSeparateWiresIsOneNet() {
        Schematic schematic = new Schematic("sda");
        schematic.addWire(wire(0, 0, 10, 0));
        schematic.addWire(wire(100, 0, 110, 0));
        schematic.addLabel(label("SDA", 10, 0));
        schematic.addLabel(label("SDA", 110, 0));
        schematic.addComponent(part("U1", "5", 0, 0));
        schematic.addComponent(part("U2", "3", 100, 0));

        Netlist netlist = analyzer.analyze(schematic);
        assertEquals(1, netlist.size());
        assertEquals(Set.of(new PinRef("U1", "5"), new PinRef("U2", "3")), pins(netlist.net("SDA")));
    }

    @Test
    void polylineCornersConnect() {
        Schematic schematic = new Schematic("corner");
        schematic.addWire(new Wire(List.of(new Point(0, 0), new Point(10, 0), new Point(10, 10)), null));
        schematic.addWire(wire(10, 10, 20, 10));
        schematic.addComponent(part("R1", "1", 0, 0));
        schematic.addComponent(part("R2", "1", 20, 10));

        Netlist netlist = analyzer.analyze(schematic);
        assertEquals(1, netlist.size());
        assertEquals(2, netlist.connectionCount());
    }

    @Test
    void multiUnitPartJoinsThroughPlacedUnitOnly() {
        String text = """
                (kicad_sch
                  (lib_symbols
                    (symbol "Amplifier_Operational:LM358"
                      (symbol "LM358_1_1"
                        (pin input line (at -7.62 -2.54 0) (length 2.54) (name "-") (number "2")))
                      (symbol "LM358_2_1"
                        (pin input line (at -7.62 -2.54 0) (length 2.54) (name "-") (number "6")))
                    )
                  )
                  (wire (pts (xy 42.38 52.54) (xy 30 52.54)))
                  (label "INN" (at 30 52.54 0))
                  (symbol (lib_id "Amplifier_Operational:LM358") (at 50 50 0) (unit 2)
                    (property "Reference" "U1" (at 50 45 0)))
                )
                """;
        Netlist netlist = analyzer.analyze(new KicadSchParser().parse(text));
        assertEquals(Set.of(new PinRef("U1", "6")), pins(netlist.net("INN")));
    }

    @Test
    void emptySchematicGivesEmptyNetlist() {
        Netlist netlist = analyzer.analyze(new Schematic(""));
        assertTrue(netlist.isEmpty());
        assertEquals(0, netlist.connectionCount());
    }

    @Test
    void hierarchyIsAnalyzedPerSheet() {
        Schematic divider = new KicadSchParser().parse(Fixtures.divider());
        HierarchicalSchematic hierarchy = new HierarchicalSchematic("board.kicad_sch", "board",
                List.of(new SheetEntry("board", new Schematic("")), new SheetEntry("board_Divider", divider)),
                List.of());

        Map<String, Netlist> netlists = analyzer.analyze(hierarchy);
        assertEquals(List.of("board", "board_Divider"), List.copyOf(netlists.keySet()));
        assertTrue(netlists.get("board").isEmpty());
        assertEquals(2, netlists.get("board_Divider").size());
    }

    @Test
    void settingsRejectNonPositiveTolerance() {
        assertThrows(IllegalArgumentException.class,
                () -> ConnectivitySettings.defaults().withTightTolerance(0));
        assertThrows(IllegalArgumentException.class,
                () -> ConnectivitySettings.defaults().withLooseTolerance(-1));
    }
}
