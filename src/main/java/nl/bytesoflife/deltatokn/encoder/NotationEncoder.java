package nl.bytesoflife.deltatokn.encoder;

import nl.bytesoflife.deltatokn.connectivity.Netlist;
import nl.bytesoflife.deltatokn.schematic.model.HierarchicalSchematic;
import nl.bytesoflife.deltatokn.schematic.model.Schematic;

import java.util.Map;

/**
 * Serializes resolved schematics. Output is a pure function of the input: the same model always
 * produces the same text.
 */
public sealed interface NotationEncoder permits ToknEncoder, MarkdownEncoder, JsonEncoder {

    String encode(HierarchicalSchematic hierarchy);

    /**
     * Encodes with nets that were already analyzed, keyed by sheet path. A sheet missing from
     * {@code netlists} is analyzed here.
     */
    String encode(HierarchicalSchematic hierarchy, Map<String, Netlist> netlists);

    String encodeSheet(Schematic schematic);
}
