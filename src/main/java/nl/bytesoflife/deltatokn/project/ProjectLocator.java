package nl.bytesoflife.deltatokn.project;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the root schematic of a KiCad project directory.
 * <p>
 * Preference order:
 * <ol>
 *   <li>the schematic named by {@code schematic.filename} in the project descriptor, if it exists</li>
 *   <li>the schematic sharing the descriptor's base name</li>
 *   <li>any schematic in the directory, named after its own base name</li>
 * </ol>
 * When a directory holds several candidates of one kind, the first by file name wins.
 */
public class ProjectLocator {

    private static final Logger log = LoggerFactory.getLogger(ProjectLocator.class);

    public static final String PROJECT_EXTENSION = ".kicad_pro";
    public static final String SCHEMATIC_EXTENSION = ".kicad_sch";

    private final KicadProParser projectParser = new KicadProParser();

    public ProjectRoot findProjectRoot(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            log.debug("{} is not a directory", directory);
            return ProjectRoot.none();
        }

        Optional<Path> descriptor = firstWithExtension(directory, PROJECT_EXTENSION);
        if (descriptor.isPresent()) {
            Path pro = descriptor.get();
            String projectName = stem(pro);

            Optional<Path> named = schematicNamedBy(pro, directory);
            if (named.isPresent()) {
                log.debug("Root schematic {} named by {}", named.get().getFileName(), pro.getFileName());
                return ProjectRoot.of(named.get(), projectName);
            }

            Path sameName = directory.resolve(projectName + SCHEMATIC_EXTENSION);
            if (Files.isRegularFile(sameName)) {
                log.debug("Root schematic {} matches project {}", sameName.getFileName(), projectName);
                return ProjectRoot.of(sameName, projectName);
            }
            log.debug("Project {} names no existing schematic, looking for any schematic", pro.getFileName());
        }

        Optional<Path> anySchematic = firstWithExtension(directory, SCHEMATIC_EXTENSION);
        if (anySchematic.isPresent()) {
            Path sch = anySchematic.get();
            log.debug("Using {} as root schematic", sch.getFileName());
            return ProjectRoot.of(sch, stem(sch));
        }
        return ProjectRoot.none();
    }

    private Optional<Path> schematicNamedBy(Path descriptor, Path directory) throws IOException {
        KicadProject project;
        try {
            project = projectParser.parse(Files.readString(descriptor, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed project file {}: {}", descriptor.getFileName(), e.getMessage());
            return Optional.empty();
        }
        if (project.schematicFilename() == null) {
            return Optional.empty();
        }
        Path candidate = directory.resolve(project.schematicFilename());
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private static Optional<Path> firstWithExtension(Path directory, String extension) throws IOException {
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + extension)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    matches.add(p);
                }
            }
        }
        return matches.stream()
                .min((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
