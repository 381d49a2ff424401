package nl.bytesoflife.deltatokn.generator;

import nl.bytesoflife.deltatokn.connectivity.ConnectivityAnalyzer;
import nl.bytesoflife.deltatokn.connectivity.Netlist;
import nl.bytesoflife.deltatokn.generator.GenerationEvent.GenerationCompleted;
import nl.bytesoflife.deltatokn.generator.GenerationEvent.GenerationFailed;
import nl.bytesoflife.deltatokn.generator.GenerationEvent.GenerationStarted;
import nl.bytesoflife.deltatokn.generator.GenerationEvent.SheetSkipped;
import nl.bytesoflife.deltatokn.project.HierarchyResolver;
import nl.bytesoflife.deltatokn.project.ProjectLocator;
import nl.bytesoflife.deltatokn.project.ProjectRoot;
import nl.bytesoflife.deltatokn.schematic.model.Component;
import nl.bytesoflife.deltatokn.schematic.model.HierarchicalSchematic;
import nl.bytesoflife.deltatokn.schematic.model.SkippedSheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Runs the whole pipeline for a project directory: locate the root schematic, resolve the sheet
 * hierarchy, encode it and write the result. Runs on the calling thread. Callers that generate
 * into the same output file from several threads must serialize those calls.
 */
public class NetlistGenerator {

    private static final Logger log = LoggerFactory.getLogger(NetlistGenerator.class);

    private final ProjectLocator locator;
    private final HierarchyResolver resolver;
    private final OutputWriter writer;

    public NetlistGenerator() {
        this(new ProjectLocator(), new HierarchyResolver(), new OutputWriter());
    }

    public NetlistGenerator(ProjectLocator locator, HierarchyResolver resolver, OutputWriter writer) {
        this.locator = locator;
        this.resolver = resolver;
        this.writer = writer;
    }

    /**
     * Generates and writes the output file. Never throws for pipeline failures: they are logged,
     * published as {@link GenerationFailed} and returned, and the previous output file is left as
     * it was.
     */
    public GenerationResult generate(GenerationSession session) {
        EventChannel events = session.getEvents();
        Path output = session.getOutputFile();
        events.publish(new GenerationStarted(session.getProjectDirectory()));

        try {
            HierarchicalSchematic hierarchy = resolve(session);
            for (SkippedSheet skipped : hierarchy.getSkippedSheets()) {
                events.publish(new SheetSkipped(skipped));
            }

            Map<String, Netlist> netlists = new ConnectivityAnalyzer(session.getSettings()).analyze(hierarchy);
            String text = session.getFormat().encoder(session.getSettings()).encode(hierarchy, netlists);
            writer.write(output, text);

            int components = (int) hierarchy.getAllComponents().stream()
                    .map(Component::getReference)
                    .distinct()
                    .count();
            int nets = netlists.values().stream()
                    .mapToInt(Netlist::size)
                    .sum();

            log.info("Generated {} for {}: {} sheet(s), {} component(s), {} net(s)", output.getFileName(),
                    hierarchy.getProjectName(), hierarchy.getSheets().size(), components, nets);
            events.publish(new GenerationCompleted(components, nets, output));
            return GenerationResult.succeeded(output, components, nets, hierarchy.getSkippedSheets());
        } catch (IOException | RuntimeException e) {
            String reason = describe(e);
            log.error("Generation failed for {}: {}", session.getProjectDirectory(), reason, e);
            events.publish(new GenerationFailed(reason));
            return GenerationResult.failed(output, reason);
        }
    }

    /**
     * Returns the encoded text without writing anything.
     */
    public String render(GenerationSession session) throws IOException {
        HierarchicalSchematic hierarchy = resolve(session);
        return session.getFormat().encoder(session.getSettings()).encode(hierarchy);
    }

    private HierarchicalSchematic resolve(GenerationSession session) throws IOException {
        ProjectRoot root = locator.findProjectRoot(session.getProjectDirectory());
        if (!root.isFound()) {
            throw new NoSuchFileException(session.getProjectDirectory().toString(), null,
                    "no KiCad schematic found");
        }
        return resolver.parseHierarchy(root.rootFile().get(), root.projectName().get());
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        if (e instanceof NoSuchFileException) {
            return message;
        }
        return message != null ? e.getClass().getSimpleName() + ": " + message : e.getClass().getSimpleName();
    }
}
