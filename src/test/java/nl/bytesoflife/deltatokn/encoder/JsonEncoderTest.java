package nl.bytesoflife.deltatokn.encoder;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonEncoderTest {

    private final JsonEncoder encoder = new JsonEncoder();

    @Test
    void encodeDivider() {
        String expected = "{\"project\":\"divider\",\"sheets\":[{\"path\":\"divider\",\"title\":\"Divider\","
                + "\"components\":["
                + "{\"ref\":\"R1\",\"type\":\"R\",\"value\":\"10k\",\"footprint\":\"0603\",\"libId\":\"Device:R\",\"dnp\":false},"
                + "{\"ref\":\"R2\",\"type\":\"R\",\"value\":\"1k\",\"footprint\":\"0603\",\"libId\":\"Device:R\",\"dnp\":false}],"
                + "\"nets\":[{\"name\":\"GND\",\"pins\":[\"R2.2\"]},{\"name\":\"VCC\",\"pins\":[\"R1.2\",\"R2.1\"]}]}]}";
        assertEquals(expected, encoder.encode(EncoderFixtures.dividerHierarchy()));
    }

    @Test
    void escapeJson() {
        assertEquals("\"a\\\"b\\\\c\\nd\"", JsonEncoder.escapeJson("a\"b\\c\nd"));
        assertEquals("\"\\u0001\"", JsonEncoder.escapeJson("\u0001"));
        assertEquals("null", JsonEncoder.escapeJson(null));
    }

    @Test
    void dnpIsWritten() {
        assertTrue(encoder.encodeSheet(EncoderFixtures.opampBoard()).contains("\"ref\":\"R7\",\"type\":\"R\",\"value\":\"10k 1%\",\"footprint\":\"\",\"libId\":\"Device:R\",\"dnp\":true"));
    }
}
