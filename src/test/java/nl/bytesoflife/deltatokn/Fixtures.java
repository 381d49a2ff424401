package nl.bytesoflife.deltatokn;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Fixtures {

    public static final String[] DIVIDER_FILES = {"divider.kicad_sch", "divider.kicad_pro"};

    private Fixtures() {
    }

    public static String read(String resource) {
        try (InputStream is = Fixtures.class.getResourceAsStream("/fixtures/" + resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Missing test fixture " + resource);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String divider() {
        return read("divider/divider.kicad_sch");
    }

    /**
     * Copies the divider project into {@code directory}.
     */
    public static void copyDivider(Path directory) throws IOException {
        for (String file : DIVIDER_FILES) {
            Files.writeString(directory.resolve(file), read("divider/" + file), StandardCharsets.UTF_8);
        }
    }

    /**
     * A minimal schematic holding only sheet references, as (name, file) pairs.
     */
    public static String sheetsOnly(String... nameFilePairs) {
        StringBuilder sb = new StringBuilder("(kicad_sch (version 20231120) (generator \"eeschema\")\n");
        for (int i = 0; i + 1 < nameFilePairs.length; i += 2) {
            sb.append("  (sheet (at 10 10) (size 20 10)\n")
              .append("    (uuid \"sheet-").append(i / 2).append("\")\n")
              .append("    (property \"Sheetname\" \"").append(nameFilePairs[i]).append("\" (at 10 9 0))\n")
              .append("    (property \"Sheetfile\" \"").append(nameFilePairs[i + 1]).append("\" (at 10 31 0))\n")
              .append("  )\n");
        }
        sb.append(")\n");
        return sb.toString();
    }
}
