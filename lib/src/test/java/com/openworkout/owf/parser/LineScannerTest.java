package com.openworkout.owf.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

final class LineScannerTest {

    private static List<LineKind> kinds(String text) {
        List<LineKind> kinds = new ArrayList<>();
        for (ScannedLine line : new LineScanner("test.owf", text)) {
            kinds.add(line.getKind());
        }
        return kinds;
    }

    @Test
    void classifiesByPrefix() {
        String text =
                String.join(
                        "\n",
                        "---",
                        "## Saturday",
                        "# Ride [bike]",
                        "- bike 5min",
                        "  - run 1km",
                        "> note",
                        "",
                        "free text");
        assertEquals(
                List.of(
                        LineKind.METADATA_FENCE,
                        LineKind.SESSION_HEADING,
                        LineKind.WORKOUT_HEADING,
                        LineKind.STEP,
                        LineKind.STEP,
                        LineKind.NOTE,
                        LineKind.BLANK,
                        LineKind.TEXT),
                kinds(text));
    }

    @Test
    void bareMarkersAreRecognized() {
        assertEquals(
                List.of(LineKind.SESSION_HEADING, LineKind.WORKOUT_HEADING, LineKind.STEP, LineKind.NOTE),
                kinds("##\n#\n-\n>"));
    }

    @Test
    void recordsDepthAndColumns() {
        List<ScannedLine> lines = new LineScanner("test.owf", "    -   squat 5x5\n  > deep").scanAll();
        ScannedLine step = lines.get(0);
        assertEquals(2, step.getDepth());
        assertEquals("squat 5x5", step.getContent());
        assertEquals(5, step.getLocation().getColumn());
        assertEquals(9, step.getContentColumn());
        assertEquals(1, lines.get(1).getDepth());
        assertEquals("deep", lines.get(1).getContent());
    }

    @Test
    void oddIndentAndTabsAreText() {
        assertEquals(List.of(LineKind.TEXT, LineKind.TEXT, LineKind.TEXT), kinds("   - squat\n\t- squat\n  # heading"));
    }

    @Test
    void headingLookalikesAreText() {
        assertEquals(List.of(LineKind.TEXT, LineKind.TEXT, LineKind.TEXT), kinds("#tag\n### deep\n-- dash"));
    }

    @Test
    void acceptsCrLfAndTrailingWhitespace() {
        List<ScannedLine> lines = new LineScanner("test.owf", "# Ride   \r\n- bike 5min  \r\n---  ").scanAll();
        assertEquals("Ride", lines.get(0).getContent());
        assertEquals("bike 5min", lines.get(1).getContent());
        assertEquals(LineKind.METADATA_FENCE, lines.get(2).getKind());
    }

    @Test
    void everyIterationRestartsTheScan() {
        LineScanner scanner = new LineScanner("test.owf", "# A\n- run 1km");
        assertEquals(scanner.scanAll().size(), scanner.scanAll().size());
        assertEquals(2, scanner.scanAll().size());
    }
}
