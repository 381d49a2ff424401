package nl.bytesoflife.deltatokn.schematic.parser;

import nl.bytesoflife.deltatokn.schematic.model.MirrorAxis;
import nl.bytesoflife.deltatokn.schematic.model.Pin;
import nl.bytesoflife.deltatokn.schematic.model.Placement;
import nl.bytesoflife.deltatokn.schematic.model.Point;

/**
 * Maps a pin from its symbol frame (Y up) to absolute sheet coordinates (Y down).
 */
public final class PinTransform {

    private PinTransform() {
    }

    public static Point apply(Pin pin, Placement placement) {
        return apply(pin.x(), pin.y(), placement);
    }

    public static Point apply(double pinX, double pinY, Placement placement) {
        double px = pinX;
        double py = -pinY;

        if (placement.mirror() == MirrorAxis.X) {
            py = -py;
        } else if (placement.mirror() == MirrorAxis.Y) {
            px = -px;
        }

        // The Y flip above reversed handedness, so the sheet rotation is applied negated
        double rad = Math.toRadians(-placement.angle());
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);

        double rx = px * cos - py * sin;
        double ry = px * sin + py * cos;

        Point origin = placement.position();
        return new Point(origin.x() + rx, origin.y() + ry);
    }
}
