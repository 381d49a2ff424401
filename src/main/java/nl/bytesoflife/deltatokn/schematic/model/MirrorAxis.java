package nl.bytesoflife.deltatokn.schematic.model;

public enum MirrorAxis {
    NONE,
    X,
    Y;

    public static MirrorAxis fromKicadName(String name) {
        if (name == null) return NONE;
        return switch (name.toLowerCase()) {
            case "x" -> X;
            case "y" -> Y;
            default -> NONE;
        };
    }
}
