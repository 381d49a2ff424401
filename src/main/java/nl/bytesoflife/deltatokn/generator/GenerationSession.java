package nl.bytesoflife.deltatokn.generator;

import nl.bytesoflife.deltatokn.connectivity.ConnectivitySettings;
import nl.bytesoflife.deltatokn.encoder.OutputFormat;

import java.nio.file.Path;

/**
 * Everything one caller needs to generate a netlist for a project: where the project lives,
 * where the output goes, how it is encoded and who hears about it.
 */
public class GenerationSession {

    public static final String DEFAULT_OUTPUT_NAME = "netlist";

    private final Path projectDirectory;
    private String outputFileName;
    private OutputFormat format = OutputFormat.TOKN;
    private ConnectivitySettings settings = ConnectivitySettings.defaults();
    private EventChannel events = new EventChannel();

    public GenerationSession(Path projectDirectory) {
        if (projectDirectory == null) {
            throw new IllegalArgumentException("project directory must not be null");
        }
        this.projectDirectory = projectDirectory;
    }

    /**
     * Output file name, resolved against the project directory.
     */
    public GenerationSession withOutputFile(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("output file name must not be empty");
        }
        this.outputFileName = fileName;
        return this;
    }

    public GenerationSession withFormat(OutputFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("output format must not be null");
        }
        this.format = format;
        return this;
    }

    public GenerationSession withSettings(ConnectivitySettings settings) {
        this.settings = settings;
        return this;
    }

    public GenerationSession withEvents(EventChannel events) {
        this.events = events;
        return this;
    }

    public Path getProjectDirectory() {
        return projectDirectory;
    }

    /**
     * The configured output file, or {@code netlist.<extension>} for the current format.
     */
    public Path getOutputFile() {
        if (outputFileName != null) {
            return projectDirectory.resolve(outputFileName);
        }
        return projectDirectory.resolve(DEFAULT_OUTPUT_NAME + "." + format.getExtension());
    }

    public OutputFormat getFormat() {
        return format;
    }

    public ConnectivitySettings getSettings() {
        return settings;
    }

    public EventChannel getEvents() {
        return events;
    }
}
