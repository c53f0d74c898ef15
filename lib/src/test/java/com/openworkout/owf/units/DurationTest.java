package com.openworkout.owf.units;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

final class DurationTest {

    @Test
    void parsesClockForms() {
        assertEquals(Duration.ofSeconds(5282), Duration.parse("1:28:02"));
        assertEquals(Duration.ofSeconds(90), Duration.parse("1:30"));
    }

    @Test
    void parsesCompoundForm() {
        assertEquals(Duration.ofSeconds(5282), Duration.parse("1h28min2s"));
        assertEquals(Duration.ofSeconds(3600), Duration.parse("1h"));
        assertEquals(Duration.ofSeconds(45), Duration.parse("45s"));
    }

    @Test
    void parsesSingleUnitDecimals() {
        assertEquals(Duration.ofSeconds(90), Duration.parse("1.5min"));
        assertEquals(Duration.ofSeconds(30), Duration.parse("30sec"));
        assertEquals(Duration.ofSeconds(7200), Duration.parse("2hrs"));
        assertEquals(Duration.ofSeconds(new BigDecimal("2.5")), Duration.parse("2.5s"));
    }

    @Test
    void bareNumberNeedsDefaultUnit() {
        assertNull(Duration.tryParse("10"));
        assertEquals(Duration.ofMinutes(10), Duration.tryParse("10", true));
        assertThrows(IllegalArgumentException.class, () -> Duration.parse("ten minutes"));
    }

    @Test
    void rejectsNonDurations() {
        assertNull(Duration.tryParse("5km"));
        assertNull(Duration.tryParse("3x8"));
        assertNull(Duration.tryParse("1:75"));
    }

    @Test
    void formatsCompound() {
        assertEquals("1min30s", Duration.ofSeconds(90).toString());
        assertEquals("1h28min2s", Duration.ofSeconds(5282).toString());
        assertEquals("10min", Duration.ofMinutes(10).toString());
        assertEquals("2.5s", Duration.ofSeconds(new BigDecimal("2.5")).toString());
        assertEquals("0s", Duration.ofSeconds(0).toString());
    }

    @Test
    void largeClockValuesDoNotOverflow() {
        Duration huge = Duration.parse("99999999999999999999:00");
        assertEquals(new BigDecimal("5999999999999999999940"), huge.getSeconds());
        assertEquals(new BigDecimal("359999999999999999996400"), Duration.parse("99999999999999999999:00:00").getSeconds());
        assertEquals("1666666666666666666h39min", huge.toString());
    }
}
