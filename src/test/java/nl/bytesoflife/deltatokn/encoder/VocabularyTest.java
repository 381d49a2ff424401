package nl.bytesoflife.deltatokn.encoder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyTest {

    @ParameterizedTest
    @CsvSource({
            "Device:R, R",
            "Device:R_Small, R",
            "Device:R_US, R",
            "Device:C_Polarized, CP",
            "Device:Crystal, Y",
            "Amplifier_Operational:LM358, LM358",
            "MCU_ST:STM32F103C8Tx, STM32F103C8Tx",
            "NoLibrary, NoLibrary"
    })
    void normalizeType(String libId, String expected) {
        assertEquals(expected, Vocabulary.normalizeType(libId));
    }

    @ParameterizedTest
    @CsvSource({
            "Resistor_SMD:R_0603_1608Metric, 0603",
            "Capacitor_SMD:C_0805_2012Metric_Pad1.18x1.45mm_HandSolder, 0805",
            "Package_SO:SOIC-8_3.9x4.9mm_P1.27mm, SOIC-8",
            "Package_DFN_QFN:QFN-32-1EP_5x5mm_P0.5mm_EP3.45x3.45mm, QFN-32-1EP",
            "Package_TO_SOT_SMD:SOT-23, SOT-23",
            "Connector_PinHeader_2.54mm:PinHeader_1x04_P2.54mm_Vertical, PinHeader_1x04_P2.54mm_Vertical",
            "'', ''"
    })
    void normalizeFootprint(String footprint, String expected) {
        assertEquals(expected, Vocabulary.normalizeFootprint(footprint));
    }

    @ParameterizedTest
    @CsvSource({
            "100nF, 100n",
            "4.7kΩ, 4.7k",
            "10µF, 10u",
            "10 uH, 10u",
            "470R, 470",
            "10k, 10k",
            "LM358, LM358",
            "~, ''",
            "100nF 50V, 100nF 50V"
    })
    void normalizeValue(String value, String expected) {
        assertEquals(expected, Vocabulary.normalizeValue(value));
    }

    @Test
    void nullsBecomeEmpty() {
        assertEquals("", Vocabulary.normalizeType(null));
        assertEquals("", Vocabulary.normalizeFootprint(null));
        assertEquals("", Vocabulary.normalizeValue(null));
    }
}
