package nl.bytesoflife.deltatokn.schematic.model;

/**
 * A sheet of a hierarchy together with its unique hierarchical path, e.g. {@code board_Power_Supply}.
 */
public record SheetEntry(String path, Schematic schematic) {
}
