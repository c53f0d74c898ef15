package com.openworkout.owf.units;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

final class DecimalParserTest {

    @Test
    void parsesDotDecimal() {
        assertEquals(0, new BigDecimal("1234.56").compareTo(DecimalParser.parse("1234.56")));
    }

    @Test
    void returnsNullForBlank() {
        assertNull(DecimalParser.parse("   "));
        assertNull(DecimalParser.parse(null));
    }

    @Test
    void rejectsCommaDecimalAndSigns() {
        assertThrows(NumberFormatException.class, () -> DecimalParser.parse("1,5"));
        assertThrows(NumberFormatException.class, () -> DecimalParser.parse("-2"));
        assertThrows(NumberFormatException.class, () -> DecimalParser.parse("1e3"));
    }

    @Test
    void formatsWithoutTrailingZeros() {
        assertEquals("80", DecimalParser.format(new BigDecimal("80.000")));
        assertEquals("2.5", DecimalParser.format(new BigDecimal("2.50")));
        assertEquals("200", DecimalParser.format(new BigDecimal("2E+2")));
        assertEquals("0", DecimalParser.format(new BigDecimal("0.00")));
    }
}
