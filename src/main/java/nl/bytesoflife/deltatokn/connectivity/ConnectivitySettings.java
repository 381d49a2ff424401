package nl.bytesoflife.deltatokn.connectivity;

/**
 * Tolerances and naming rules for {@link ConnectivityAnalyzer}. Instances are immutable; every
 * {@code withX} method returns a copy.
 * <p>
 * Tolerances are in schematic millimetres. KiCad places connection points on a 1.27 mm (50 mil)
 * grid, so the tight tolerance only absorbs rounding noise while the loose tolerance stays below
 * two grid steps.
 */
public final class ConnectivitySettings {

    public static final double DEFAULT_TIGHT_TOLERANCE = 0.01;
    public static final double DEFAULT_LOOSE_TOLERANCE = 2.0;

    /**
     * How a net is named when several labels touch it.
     */
    public enum LabelPolicy {
        /** The first matching label in file order. */
        FIRST_IN_PARSE_ORDER,
        /** The lexicographically smallest matching label text. */
        LEXICOGRAPHIC
    }

    private static final ConnectivitySettings DEFAULTS = new ConnectivitySettings(
            DEFAULT_TIGHT_TOLERANCE, DEFAULT_LOOSE_TOLERANCE, LabelPolicy.LEXICOGRAPHIC, false);

    private final double tightTolerance;
    private final double looseTolerance;
    private final LabelPolicy labelPolicy;
    private final boolean powerSymbolNaming;

    private ConnectivitySettings(double tightTolerance, double looseTolerance, LabelPolicy labelPolicy,
                                 boolean powerSymbolNaming) {
        this.tightTolerance = tightTolerance;
        this.looseTolerance = looseTolerance;
        this.labelPolicy = labelPolicy;
        this.powerSymbolNaming = powerSymbolNaming;
    }

    public static ConnectivitySettings defaults() {
        return DEFAULTS;
    }

    /**
     * Distance below which two wire or junction points are the same point.
     */
    public ConnectivitySettings withTightTolerance(double tolerance) {
        requirePositive(tolerance, "tight tolerance");
        return new ConnectivitySettings(tolerance, looseTolerance, labelPolicy, powerSymbolNaming);
    }

    /**
     * Distance below which a label or pin touches a net.
     */
    public ConnectivitySettings withLooseTolerance(double tolerance) {
        requirePositive(tolerance, "loose tolerance");
        return new ConnectivitySettings(tightTolerance, tolerance, labelPolicy, powerSymbolNaming);
    }

    public ConnectivitySettings withLabelPolicy(LabelPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("label policy must not be null");
        }
        return new ConnectivitySettings(tightTolerance, looseTolerance, policy, powerSymbolNaming);
    }

    /**
     * Whether the value of a power symbol (e.g. {@code +3V3}) names a net that no label names.
     * Off by default, so such nets keep their {@code Net_<n>} name.
     */
    public ConnectivitySettings withPowerSymbolNaming(boolean enabled) {
        return new ConnectivitySettings(tightTolerance, looseTolerance, labelPolicy, enabled);
    }

    public double getTightTolerance() {
        return tightTolerance;
    }

    public double getLooseTolerance() {
        return looseTolerance;
    }

    public LabelPolicy getLabelPolicy() {
        return labelPolicy;
    }

    public boolean isPowerSymbolNaming() {
        return powerSymbolNaming;
    }

    private static void requirePositive(double value, String what) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(what + " must be positive, got " + value);
        }
    }

    @Override
    public String toString() {
        return "ConnectivitySettings{tight=" + tightTolerance + ", loose=" + looseTolerance
                + ", labels=" + labelPolicy + ", powerNaming=" + powerSymbolNaming + "}";
    }
}
