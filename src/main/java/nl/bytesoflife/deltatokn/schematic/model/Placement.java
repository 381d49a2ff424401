package nl.bytesoflife.deltatokn.schematic.model;

/**
 * Where and how a symbol is placed on the sheet.
 *
 * @param angle     rotation in degrees, KiCad uses 0, 90, 180 and 270 but any value is accepted
 * @param unit      placed unit, 1 based
 * @param bodyStyle placed body style, 1 for the normal style and 2 for the De Morgan style
 */
public record Placement(Point position, double angle, MirrorAxis mirror, int unit, int bodyStyle) {

    public Placement {
        if (mirror == null) mirror = MirrorAxis.NONE;
    }
}
