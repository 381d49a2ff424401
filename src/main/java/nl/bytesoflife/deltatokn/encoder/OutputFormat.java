package nl.bytesoflife.deltatokn.encoder;

import nl.bytesoflife.deltatokn.connectivity.ConnectivitySettings;

public enum OutputFormat {
    TOKN("tokn"),
    MARKDOWN("md"),
    JSON("json");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public NotationEncoder encoder(ConnectivitySettings settings) {
        return switch (this) {
            case TOKN -> new ToknEncoder(settings);
            case MARKDOWN -> new MarkdownEncoder(settings);
            case JSON -> new JsonEncoder(settings);
        };
    }

    /**
     * Looks up a format by name or file extension, ignoring case.
     */
    public static OutputFormat fromName(String name) {
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(name) || format.extension.equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + name);
    }
}
