package nl.bytesoflife.deltatokn.encoder;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shortens symbol names, footprints and values to the tokens used in the encoded output.
 * Strings that match no rule come back unchanged, apart from losing their library prefix.
 */
public final class Vocabulary {

    private static final Map<String, String> SYMBOL_TYPES = Map.ofEntries(
            Map.entry("R_Small", "R"),
            Map.entry("R_US", "R"),
            Map.entry("R_Small_US", "R"),
            Map.entry("R_POT", "RV"),
            Map.entry("R_Potentiometer", "RV"),
            Map.entry("C_Small", "C"),
            Map.entry("C_Polarized", "CP"),
            Map.entry("C_Polarized_Small", "CP"),
            Map.entry("CP_Small", "CP"),
            Map.entry("L_Small", "L"),
            Map.entry("D_Small", "D"),
            Map.entry("D_Schottky", "D"),
            Map.entry("D_Schottky_Small", "D"),
            Map.entry("D_Zener", "DZ"),
            Map.entry("D_Zener_Small", "DZ"),
            Map.entry("LED_Small", "LED"),
            Map.entry("Crystal", "Y"),
            Map.entry("Crystal_Small", "Y"),
            Map.entry("Ferrite_Bead", "FB"),
            Map.entry("Ferrite_Bead_Small", "FB"),
            Map.entry("Fuse", "F"),
            Map.entry("Fuse_Small", "F"),
            Map.entry("SW_Push", "SW"),
            Map.entry("TestPoint", "TP")
    );

    // R_0603_1608Metric, C_0805_2012Metric_Pad1.18x1.45mm_HandSolder
    private static final Pattern METRIC_PASSIVE = Pattern.compile("^[A-Za-z]+_(\\d{4})_\\d{4}Metric.*");

    // SOIC-8_3.9x4.9mm_P1.27mm, QFN-32-1EP_5x5mm_P0.5mm_EP3.45x3.45mm
    private static final Pattern PACKAGE_FAMILY = Pattern.compile(
            "^((?:SOIC|SOP|SSOP|TSSOP|MSOP|QFN|DFN|QFP|LQFP|TQFP|SOT|SOD|TO|DIP|BGA|WSON|VQFN)-[^_]+)_.*");

    // 100nF, 4.7kΩ, 10 uH, 470R
    private static final Pattern UNIT_VALUE = Pattern.compile(
            "^(\\d+(?:\\.\\d+)?)\\s*([pnumkKMG]?)(?:F|H|\\u03A9|\\u2126|Ohm|ohm|R)$");

    private Vocabulary() {
    }

    public static String normalizeType(String libId) {
        if (libId == null) return "";
        String name = stripLibrary(libId);
        return SYMBOL_TYPES.getOrDefault(name, name);
    }

    public static String normalizeFootprint(String footprint) {
        if (footprint == null) return "";
        String name = stripLibrary(footprint.trim());

        Matcher passive = METRIC_PASSIVE.matcher(name);
        if (passive.matches()) {
            return passive.group(1);
        }
        Matcher family = PACKAGE_FAMILY.matcher(name);
        if (family.matches()) {
            return family.group(1);
        }
        return name;
    }

    public static String normalizeValue(String value) {
        if (value == null) return "";
        String v = value.trim();
        if ("~".equals(v)) return "";
        // micro sign and greek mu
        v = v.replace('\u00B5', 'u').replace('\u03BC', 'u');

        Matcher m = UNIT_VALUE.matcher(v);
        if (m.matches()) {
            return m.group(1) + m.group(2);
        }
        return v;
    }

    private static String stripLibrary(String id) {
        int colon = id.indexOf(':');
        return colon >= 0 ? id.substring(colon + 1) : id;
    }
}
