package nl.bytesoflife.deltatokn.schematic.model;

public enum LabelType {
    LOCAL("label"),
    GLOBAL("global_label"),
    HIERARCHICAL("hierarchical_label");

    private final String kicadTag;

    LabelType(String kicadTag) {
        this.kicadTag = kicadTag;
    }

    public String getKicadTag() {
        return kicadTag;
    }

    /**
     * The label type written with {@code tag}, or null when the tag is not a label.
     */
    public static LabelType fromKicadTag(String tag) {
        for (LabelType type : values()) {
            if (type.kicadTag.equals(tag)) {
                return type;
            }
        }
        return null;
    }
}
