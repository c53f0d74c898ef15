package com.openworkout.owf.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.openworkout.owf.Owf;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.ast.Heading;
import com.openworkout.owf.ast.Session;
import com.openworkout.owf.ast.Workout;
import com.openworkout.owf.testing.TestResources;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class SerializerTest {

    private static String canonical(String text) throws Exception {
        return Owf.dumps(Owf.parse(text));
    }

    @Test
    void normalizesSpacingAndSpellings() throws Exception {
        assertEquals(
                TestResources.read("examples/messy.canonical.owf"),
                canonical(TestResources.read("examples/messy.owf")));
    }

    @Test
    void writesFrontmatterThenEntries() throws Exception {
        String text = "---\nFTP: 250W\n---\n# Ride [bike]\n- bike 5min @95% of FTP\n# Lift\n- squat 5x5 @100kg";
        assertEquals(
                String.join(
                        "\n",
                        "---",
                        "FTP: 250W",
                        "---",
                        "",
                        "# Ride [bike]",
                        "",
                        "- bike 5min @95% of FTP",
                        "",
                        "# Lift",
                        "",
                        "- squat 5x5rep @100kg",
                        ""),
                canonical(text));
    }

    @Test
    void writesStepNotesInlineAndWorkoutNotesAfterBlank() throws Exception {
        String text = "# Run\n- run 5km @easy\n> go slow\n\n> felt great";
        assertEquals("# Run\n\n- run 5km @easy\n> go slow\n\n> felt great\n", canonical(text));
    }

    @Test
    void containerNotesComeBeforeChildren() throws Exception {
        String text = "# W\n- 3x superset:\n  - dip 10\n  - chin-up 8\n> no kipping";
        assertEquals("# W\n\n- 3x superset:\n> no kipping\n  - dip 10rep\n  - chin-up 8rep\n", canonical(text));
    }

    @Test
    void rebuildsContainerHeaders() throws Exception {
        String text =
                String.join(
                        "\n",
                        "# W",
                        "- EMOM 10:",
                        "  - clean 3",
                        "- every 1.5min for 0:15:00:",
                        "  - burpee 10",
                        "- for-time 20:",
                        "  - run 1mile",
                        "- 2x circuit:",
                        "  - plank 1:30");
        assertEquals(
                String.join(
                        "\n",
                        "# W",
                        "",
                        "- emom 10min:",
                        "  - clean 3rep",
                        "- every 1min30s for 15min:",
                        "  - burpee 10rep",
                        "- for-time 20min:",
                        "  - run 1mile",
                        "- 2x circuit:",
                        "  - plank 1min30s",
                        ""),
                canonical(text));
    }

    @Test
    void writesSessions() throws Exception {
        String text = "## Saturday\n- warmup 10min\n\n> bring water\n# Ride [bike]\n- bike 1h\n# Lift [strength]\n- squat 5";
        assertEquals(
                String.join(
                        "\n",
                        "## Saturday",
                        "",
                        "- warmup 10min",
                        "",
                        "> bring water",
                        "",
                        "# Ride [bike]",
                        "",
                        "- bike 1h",
                        "",
                        "# Lift [strength]",
                        "",
                        "- squat 5rep",
                        ""),
                canonical(text));
    }

    @Test
    void omitsInferredModalityAndWritesDatesAndDefaults() throws Exception {
        Document document =
                new Document(
                        Map.of(),
                        List.of(
                                new Session(
                                        new Heading(null, "Day", null, null, null, null),
                                        List.of(),
                                        List.of(
                                                new Workout(new Heading(null, "A", "run", null, null, null), List.of(), List.of("x")),
                                                new Workout(new Heading(null, "B", "bike", null, null, null), List.of(), List.of("y"))),
                                        List.of())));
        assertEquals("## Day\n\n# A [run]\n\n> x\n\n# B [bike]\n\n> y\n", Owf.dumps(document));
        assertEquals(
                "# Long [run] (2025-02-27 06:00-07:30) @RPE 6.5 @RIR 2",
                Serializer.formatHeading(
                        Owf.parse("# Long   [run]  (2025-02-27 06:00-07:30)  @rpe 6.50 @rir 2")
                                .getEntries()
                                .get(0)
                                .getHeading(),
                        "#"));
    }

    @Test
    void anonymousWorkoutsGetBareHeadingUnlessFirst() throws Exception {
        Workout anonymous = new Workout(Heading.anonymous(null), Owf.parse("- run 1km").getAllWorkouts().get(0).getSteps(), List.of());
        Document document = new Document(Map.of(), List.of(anonymous, anonymous));
        assertEquals("- run 1km\n\n#\n\n- run 1km\n", Owf.dumps(document));
    }

    @Test
    void formatsParametersCanonically() throws Exception {
        String text = "- bike 5min @pace:2:05/km @Moderate @rpe7.50 @RIR 1 @z3 @200w @FTP - 20W @70% of max HR";
        assertEquals(
                "- bike 5min @2:05/km @moderate @RPE 7.5 @RIR 1 @Z3 @200W @FTP - 20W @70% of max HR\n",
                canonical(text));
    }
}
