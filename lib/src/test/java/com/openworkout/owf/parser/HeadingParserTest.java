package com.openworkout.owf.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.openworkout.owf.ast.Heading;
import java.time.LocalDate;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

final class HeadingParserTest {

    private static Heading parse(String line) throws OwfParseException {
        return HeadingParser.parse(LineScanner.classify("test.owf", 1, line));
    }

    @Test
    void parsesAllParts() throws Exception {
        Heading heading = parse("# Long Run [run] (2025-02-27 06:00-07:30) @RPE 6.5 @RIR 2");
        assertEquals("Long Run", heading.getName());
        assertEquals("run", heading.getModality());
        assertEquals(LocalDate.of(2025, 2, 27), heading.getDate().getDate());
        assertEquals(LocalTime.of(6, 0), heading.getDate().getStartTime());
        assertEquals(LocalTime.of(7, 30), heading.getDate().getEndTime());
        assertEquals("6.5", heading.getRpe().toPlainString());
        assertEquals(2, heading.getRir());
    }

    @Test
    void everyPartButNameIsOptional() throws Exception {
        Heading heading = parse("# Easy Spin");
        assertEquals("Easy Spin", heading.getName());
        assertNull(heading.getModality());
        assertNull(heading.getDate());
        assertNull(heading.getRpe());
        assertNull(heading.getRir());

        Heading dated = parse("# Ride (2025-03-01 18:15)");
        assertEquals(LocalTime.of(18, 15), dated.getDate().getStartTime());
        assertNull(dated.getDate().getEndTime());
        assertEquals("", parse("#").getName());
    }

    @Test
    void rejectsInvalidCalendarDate() {
        OwfParseException ex = assertThrows(OwfParseException.class, () -> parse("# Ride (2025-02-30)"));
        assertEquals(8, ex.getLocation().getColumn());
        assertThrows(OwfParseException.class, () -> parse("# Ride (2025-02-01 25:00)"));
        assertThrows(OwfParseException.class, () -> parse("# Ride (yesterday)"));
    }

    @Test
    void enforcesPartOrder() {
        assertThrows(OwfParseException.class, () -> parse("# Ride (2025-02-01) [bike]"));
        OwfParseException order =
                assertThrows(OwfParseException.class, () -> parse("# Ride @RIR 2 @RPE 7"));
        assertEquals("@RPE must come before @RIR", order.getReason());
        OwfParseException duplicate =
                assertThrows(OwfParseException.class, () -> parse("# Ride @RPE 7 @RPE 8"));
        assertEquals("Duplicate @RPE in heading", duplicate.getReason());
    }

    @Test
    void rejectsUnclosedBrackets() {
        assertThrows(OwfParseException.class, () -> parse("# Ride [bike"));
        assertThrows(OwfParseException.class, () -> parse("# Ride (2025-02-01"));
    }

    @Test
    void oversizedRirIsAParseError() {
        OwfParseException ex = assertThrows(OwfParseException.class, () -> parse("# W @RIR 99999999999"));
        assertEquals("@RIR value '99999999999' is too large", ex.getReason());
        assertEquals(5, ex.getLocation().getColumn());
    }
}
