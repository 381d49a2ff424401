package nl.bytesoflife.deltatokn.encoder;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownEncoderTest {

    private final MarkdownEncoder encoder = new MarkdownEncoder();

    @Test
    void tablesPerSheet() {
        String text = encoder.encode(EncoderFixtures.dividerHierarchy());

        assertTrue(text.startsWith("# divider\n\n## divider\n\nDivider\n"));
        assertTrue(text.contains("| Reference | Type | Value | Footprint |\n"));
        assertTrue(text.contains("| R1 | R | 10k | 0603 |\n| R2 | R | 1k | 0603 |\n"));
        assertTrue(text.contains("| GND | R2.2 |\n| VCC | R1.2, R2.1 |\n"));
    }

    @Test
    void emptyFootprintLeavesEmptyCell() {
        String text = encoder.encodeSheet(EncoderFixtures.opampBoard());
        assertTrue(text.contains("| R7 | R | 10k 1% |  |\n"));
        assertEquals(text, encoder.encodeSheet(EncoderFixtures.opampBoard()));
    }
}
