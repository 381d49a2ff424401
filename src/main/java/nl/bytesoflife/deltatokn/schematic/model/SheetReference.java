package nl.bytesoflife.deltatokn.schematic.model;

/**
 * A {@code (sheet ...)} node of a parent schematic.
 *
 * @param name     value of the Sheetname property, may be null
 * @param filename value of the Sheetfile property, relative to the parent file
 */
public record SheetReference(String name, String filename, String uuid) {
}
