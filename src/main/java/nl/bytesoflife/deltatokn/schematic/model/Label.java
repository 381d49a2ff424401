package nl.bytesoflife.deltatokn.schematic.model;

public record Label(String text, Point position, double angle, LabelType type, String uuid) {
}
