package nl.bytesoflife.deltatokn.schematic.model;

/**
 * A pin of a library symbol, positioned in the symbol's own frame (Y up).
 *
 * @param unit      unit the pin belongs to, 0 when shared by all units
 * @param bodyStyle body style the pin belongs to, 0 when shared by all styles
 */
public record Pin(String number, String name, double x, double y, double angle, PinType type,
                  int unit, int bodyStyle) {

    public boolean belongsTo(int placedUnit, int placedBodyStyle) {
        return (unit == 0 || unit == placedUnit) && (bodyStyle == 0 || bodyStyle == placedBodyStyle);
    }

    /**
     * True when the pin name carries information beyond its number.
     */
    public boolean hasMeaningfulName() {
        return name != null && !name.isEmpty() && !"~".equals(name) && !name.equals(number);
    }
}
