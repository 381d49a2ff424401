package nl.bytesoflife.deltatokn.project;

import nl.bytesoflife.deltatokn.schematic.model.Schematic;
import nl.bytesoflife.deltatokn.schematic.model.SheetEntry;
import nl.bytesoflife.deltatokn.schematic.model.SkippedSheet;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * State of one hierarchy traversal: the files already visited, the sheets collected so far and the
 * references that were left out. A new context is created for every call to
 * {@link HierarchyResolver#parseHierarchy(Path)} and passed down the recursion.
 */
final class TraversalContext {

    private final Set<Path> visited = new HashSet<>();
    private final Set<String> paths = new HashSet<>();
    private final List<SheetEntry> sheets = new ArrayList<>();
    private final List<SkippedSheet> skipped = new ArrayList<>();

    /**
     * Marks {@code file} as visited. Returns false when it was visited before.
     */
    boolean visit(Path file) {
        return visited.add(key(file));
    }

    /**
     * Adds a sheet under {@code path}, suffixing {@code _2}, {@code _3}, ... when the path is taken by a
     * sibling with the same name. Returns the path actually used.
     */
    String addSheet(String path, Schematic schematic) {
        String unique = path;
        int n = 2;
        while (!paths.add(unique)) {
            unique = path + "_" + n++;
        }
        sheets.add(new SheetEntry(unique, schematic));
        return unique;
    }

    void skip(SkippedSheet sheet) {
        skipped.add(sheet);
    }

    List<SheetEntry> getSheets() {
        return sheets;
    }

    List<SkippedSheet> getSkipped() {
        return skipped;
    }

    private static Path key(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
