package nl.bytesoflife.deltatokn.project;

import nl.bytesoflife.deltatokn.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KicadProParserTest {

    private KicadProParser parser;

    @BeforeEach
    void setUp() {
        parser = new KicadProParser();
    }

    @Test
    void readsSchematicFilename() {
        KicadProject project = parser.parse(Fixtures.read("divider/divider.kicad_pro"));
        assertEquals("divider.kicad_sch", project.schematicFilename());
        assertEquals("divider.kicad_pro", project.metaFilename());
    }

    @Test
    void missingSchematicSection() {
        KicadProject project = parser.parse("{\"meta\": {\"version\": 1}}");
        assertNull(project.schematicFilename());
        assertNull(project.metaFilename());
    }

    @Test
    void nonStringFilenameIsIgnored() {
        KicadProject project = parser.parse("{\"schematic\": {\"filename\": 42}}");
        assertNull(project.schematicFilename());
    }

    @Test
    void escapedCharactersInStrings() {
        KicadProject project = parser.parse("{\"schematic\": {\"filename\": \"my \\\"board\\\".kicad_sch\"}}");
        assertEquals("my \"board\".kicad_sch", project.schematicFilename());
    }

    @Test
    void malformedJsonFails() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"schematic\": "));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{} trailing"));
    }
}
