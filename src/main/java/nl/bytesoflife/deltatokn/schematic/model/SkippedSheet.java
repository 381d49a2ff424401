package nl.bytesoflife.deltatokn.schematic.model;

/**
 * A sheet reference that was left out of a hierarchy.
 */
public record SkippedSheet(String parentPath, String filename, Reason reason) {

    public enum Reason {
        /** The referenced file does not exist. */
        UNRESOLVED,
        /** The referenced file was already visited in this traversal. */
        CYCLIC
    }
}
