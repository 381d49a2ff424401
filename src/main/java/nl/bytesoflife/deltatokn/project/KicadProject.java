package nl.bytesoflife.deltatokn.project;

/**
 * The parts of a {@code .kicad_pro} descriptor used to find the root schematic.
 *
 * @param schematicFilename value of {@code schematic.filename}, or null when absent
 * @param metaFilename      value of {@code meta.filename}, or null when absent
 */
public record KicadProject(String schematicFilename, String metaFilename) {
}
