package nl.bytesoflife.deltatokn.project;

import nl.bytesoflife.deltatokn.schematic.model.HierarchicalSchematic;
import nl.bytesoflife.deltatokn.schematic.model.Schematic;
import nl.bytesoflife.deltatokn.schematic.model.SheetReference;
import nl.bytesoflife.deltatokn.schematic.model.SkippedSheet;
import nl.bytesoflife.deltatokn.schematic.parser.KicadSchParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses a root schematic and every sheet it references, depth first in declaration order.
 * <p>
 * A referenced file that does not exist, or that was already visited, is recorded as a
 * {@link SkippedSheet} and the traversal continues. Any other failure (a read error, malformed
 * syntax or a schema violation in a file that was found) aborts the whole call.
 */
public class HierarchyResolver {

    private static final Logger log = LoggerFactory.getLogger(HierarchyResolver.class);

    private final KicadSchParser schematicParser;

    public HierarchyResolver() {
        this(new KicadSchParser());
    }

    public HierarchyResolver(KicadSchParser schematicParser) {
        this.schematicParser = schematicParser;
    }

    /**
     * Resolves the hierarchy below {@code rootFile}, using the file's base name as project name.
     */
    public HierarchicalSchematic parseHierarchy(Path rootFile) throws IOException {
        return parseHierarchy(rootFile, ProjectLocator.stem(rootFile));
    }

    public HierarchicalSchematic parseHierarchy(Path rootFile, String projectName) throws IOException {
        TraversalContext context = new TraversalContext();

        Schematic root = schematicParser.parse(rootFile);
        context.visit(rootFile);
        String rootPath = context.addSheet(projectName, root);

        resolveSheets(root, rootFile.toAbsolutePath().getParent(), rootPath, context);

        log.debug("Resolved {} sheet(s) below {}, skipped {}", context.getSheets().size(),
                rootFile.getFileName(), context.getSkipped().size());
        return new HierarchicalSchematic(rootFile.getFileName().toString(), projectName,
                context.getSheets(), context.getSkipped());
    }

    private void resolveSheets(Schematic parent, Path baseDir, String parentPath, TraversalContext context)
            throws IOException {
        for (SheetReference reference : parent.getSheetReferences()) {
            Path sheetFile = baseDir.resolve(reference.filename());

            if (!Files.isRegularFile(sheetFile)) {
                log.warn("Sheet '{}' of {} references missing file {}", reference.name(), parentPath, sheetFile);
                context.skip(new SkippedSheet(parentPath, reference.filename(), SkippedSheet.Reason.UNRESOLVED));
                continue;
            }
            if (!context.visit(sheetFile)) {
                log.debug("Sheet file {} already visited, skipping", sheetFile);
                context.skip(new SkippedSheet(parentPath, reference.filename(), SkippedSheet.Reason.CYCLIC));
                continue;
            }

            String displayName = reference.name() != null && !reference.name().isBlank()
                    ? reference.name()
                    : ProjectLocator.stem(sheetFile);

            Schematic child = schematicParser.parse(sheetFile);
            child.setFilename(reference.filename());
            child.setTitle(displayName);

            String childPath = context.addSheet(parentPath + "_" + sanitize(displayName), child);
            resolveSheets(child, sheetFile.toAbsolutePath().getParent(), childPath, context);
        }
    }

    /**
     * Replaces spaces and path separators with underscores.
     */
    public static String sanitize(String name) {
        return name.replace(' ', '_').replace('/', '_').replace('\\', '_');
    }
}
