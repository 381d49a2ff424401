package nl.bytesoflife.deltatokn.generator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class OutputWriterTest {

    private final OutputWriter writer = new OutputWriter();

    @TempDir
    Path dir;

    @Test
    void replacesExistingFileAndLeavesNoTemporaries() throws IOException {
        Path target = dir.resolve("netlist.tokn");
        Files.writeString(target, "old");

        writer.write(target, "newµ");

        assertEquals("newµ", Files.readString(target));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void missingDirectoryFails() {
        Path target = dir.resolve("absent").resolve("netlist.tokn");
        assertThrows(IOException.class, () -> writer.write(target, "x"));
    }
}
