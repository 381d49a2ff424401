package nl.bytesoflife.deltatokn.schematic.model;

public record Junction(Point position, String uuid) {
}
