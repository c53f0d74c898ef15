package com.openworkout.owf.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.openworkout.owf.Owf;
import com.openworkout.owf.ast.AlternatingEmomStep;
import com.openworkout.owf.ast.AmrapStep;
import com.openworkout.owf.ast.CircuitStep;
import com.openworkout.owf.ast.CustomIntervalStep;
import com.openworkout.owf.ast.EmomStep;
import com.openworkout.owf.ast.EnduranceStep;
import com.openworkout.owf.ast.ForTimeStep;
import com.openworkout.owf.ast.IncludeStep;
import com.openworkout.owf.ast.IntensityParameter;
import com.openworkout.owf.ast.RepeatStep;
import com.openworkout.owf.ast.Reps;
import com.openworkout.owf.ast.RestStep;
import com.openworkout.owf.ast.Step;
import com.openworkout.owf.ast.StrengthStep;
import com.openworkout.owf.ast.SupersetStep;
import com.openworkout.owf.ast.WeightParameter;
import com.openworkout.owf.units.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

final class StepParserTest {

    private static Step step(String... lines) throws OwfParseException {
        return Owf.parse("# W\n" + String.join("\n", lines)).getEntries().get(0).getSteps().get(0);
    }

    @Test
    void parsesStrengthWithSetsRepsWeightAndRest() throws Exception {
        StrengthStep bench = assertInstanceOf(StrengthStep.class, step("- bench press 3x8rep @80kg rest:90s"));
        assertEquals("bench press", bench.getExercise());
        assertEquals(3, bench.getSets());
        assertEquals(Reps.of(8), bench.getReps());
        assertEquals(Duration.ofSeconds(90), bench.getRest());
        WeightParameter weight = assertInstanceOf(WeightParameter.class, bench.getParameters().get(0));
        assertEquals("80kg", weight.getValue().toString());
    }

    @Test
    void repsWithoutSets() throws Exception {
        StrengthStep pullUps = assertInstanceOf(StrengthStep.class, step("- pull-up 100rep"));
        assertNull(pullUps.getSets());
        assertEquals(Reps.of(100), pullUps.getReps());

        StrengthStep max = assertInstanceOf(StrengthStep.class, step("- pull-up 3xmax"));
        assertEquals(3, max.getSets());
        assertTrue(max.getReps().isMax());
    }

    @Test
    void timedStrengthSetHasNoSetsOrReps() throws Exception {
        StrengthStep plank = assertInstanceOf(StrengthStep.class, step("- plank 60s"));
        assertEquals(Duration.ofSeconds(60), plank.getDuration());
        assertNull(plank.getSets());
        assertNull(plank.getReps());
    }

    @Test
    void rejectsMalformedSetsReps() {
        OwfParseException bad = assertThrows(OwfParseException.class, () -> step("- squat 3xten"));
        assertTrue(bad.getReason().startsWith("Invalid sets x reps"));
        assertEquals(9, bad.getLocation().getColumn());
        assertThrows(OwfParseException.class, () -> step("- squat 0x5"));
        assertThrows(OwfParseException.class, () -> step("- squat 3x0"));
        assertThrows(OwfParseException.class, () -> step("- squat 3x5 60s"));
        assertThrows(OwfParseException.class, () -> step("- squat 3x5 heavy"));
    }

    @Test
    void restTokenMustBeLastAndOnStrengthOnly() {
        assertThrows(OwfParseException.class, () -> step("- squat 3x5 rest:90s @100kg"));
        assertThrows(OwfParseException.class, () -> step("- run 1km rest:90s"));
        assertThrows(OwfParseException.class, () -> step("- squat 3x5 rest:soon"));
    }

    @Test
    void parsesEnduranceMetricsInEitherOrder() throws Exception {
        EnduranceStep run = assertInstanceOf(EnduranceStep.class, step("- run 5km 25min @easy"));
        assertEquals("run", run.getAction());
        assertEquals("5km", run.getDistance().toString());
        assertEquals(Duration.ofMinutes(25), run.getDuration());
        assertInstanceOf(IntensityParameter.class, run.getParameters().get(0));

        EnduranceStep swim = assertInstanceOf(EnduranceStep.class, step("- swim 20min 1.5km"));
        assertEquals("1.5km", swim.getDistance().toString());

        EnduranceStep warmup = assertInstanceOf(EnduranceStep.class, step("- warmup jog 10min"));
        assertEquals("warmup jog", warmup.getAction());
    }

    @Test
    void rejectsDuplicateEnduranceMetrics() {
        assertThrows(OwfParseException.class, () -> step("- run 5km 10km"));
        assertThrows(OwfParseException.class, () -> step("- run 5min 10min"));
        assertThrows(OwfParseException.class, () -> step("- run 5km fast"));
    }

    @Test
    void parsesRestStep() throws Exception {
        RestStep rest = assertInstanceOf(RestStep.class, step("- rest 2min"));
        assertEquals(Duration.ofMinutes(2), rest.getDuration());
        assertInstanceOf(StrengthStep.class, step("- rest pause squat 3x5"));
    }

    @Test
    void parsesInclude() throws Exception {
        IncludeStep include = assertInstanceOf(IncludeStep.class, step("- include: Morning Mobility"));
        assertEquals("Morning Mobility", include.getWorkoutName());
        assertThrows(OwfParseException.class, () -> step("- include:"));
    }

    @Test
    void parsesEveryContainerKind() throws Exception {
        RepeatStep repeat = assertInstanceOf(RepeatStep.class, step("- 5x:", "  - bike 5min", "  - rest 1min"));
        assertEquals(5, repeat.getCount());
        assertEquals(2, repeat.getChildren().size());

        assertEquals(3, assertInstanceOf(SupersetStep.class, step("- 3x superset:", "  - dip 10")).getCount());
        assertEquals(4, assertInstanceOf(CircuitStep.class, step("- 4X Circuit:", "  - burpee 10")).getCount());

        EmomStep emom = assertInstanceOf(EmomStep.class, step("- emom 10:", "  - power clean 3rep"));
        assertEquals(Duration.ofMinutes(10), emom.getDuration());

        AlternatingEmomStep alternating =
                assertInstanceOf(AlternatingEmomStep.class, step("- emom 12min alternating:", "  - deadlift 5"));
        assertEquals(Duration.ofMinutes(12), alternating.getDuration());

        CustomIntervalStep every =
                assertInstanceOf(CustomIntervalStep.class, step("- every 90s for 15:", "  - wall ball 15"));
        assertEquals(Duration.ofSeconds(90), every.getInterval());
        assertEquals(Duration.ofMinutes(15), every.getDuration());

        AmrapStep amrap = assertInstanceOf(AmrapStep.class, step("- amrap 12min:", "  - pull-up 5"));
        assertEquals(Duration.ofMinutes(12), amrap.getDuration());

        assertNull(assertInstanceOf(ForTimeStep.class, step("- for-time:", "  - run 1mile")).getTimeCap());
        assertEquals(
                Duration.ofMinutes(20),
                assertInstanceOf(ForTimeStep.class, step("- for-time 20:", "  - run 1mile")).getTimeCap());
    }

    @Test
    void containerRules() {
        OwfParseException unknown = assertThrows(OwfParseException.class, () -> step("- tabata:", "  - squat 20"));
        assertEquals("Unknown container keyword 'tabata:'", unknown.getReason());
        assertThrows(OwfParseException.class, () -> step("- 3x:"));
        assertThrows(OwfParseException.class, () -> step("- 0x:", "  - squat 5"));
        assertThrows(OwfParseException.class, () -> step("- emom 0:", "  - squat 5"));
        OwfParseException nested =
                assertThrows(OwfParseException.class, () -> step("- squat 5", "  - lunge 5"));
        assertEquals(3, nested.getLocation().getLine());
    }

    @Test
    void containerNotesPrecedeChildren() throws Exception {
        RepeatStep repeat = assertInstanceOf(RepeatStep.class, step("- 2x:", "> hold form", "  - squat 5"));
        assertEquals(List.of("hold form"), repeat.getNotes());
        assertEquals(1, repeat.getChildren().size());
    }

    @Test
    void stepLocationIsTheDash() throws Exception {
        RepeatStep repeat = assertInstanceOf(RepeatStep.class, step("- 2x:", "  - squat 5"));
        assertEquals(2, repeat.getLocation().getLine());
        assertEquals(1, repeat.getLocation().getColumn());
        assertEquals(3, repeat.getChildren().get(0).getLocation().getColumn());
    }

    @Test
    void oversizedCountsAreParseErrors() {
        OwfParseException sets = assertThrows(OwfParseException.class, () -> step("- squat 99999999999x5"));
        assertEquals("Sets '99999999999' is too large", sets.getReason());
        assertEquals(2, sets.getLocation().getLine());
        assertThrows(OwfParseException.class, () -> step("- squat 3x99999999999"));
        assertThrows(OwfParseException.class, () -> step("- squat 5x5 @RIR 99999999999"));
        assertThrows(OwfParseException.class, () -> step("- 99999999999x:", "  - squat 5"));
    }

    @Test
    void oversizedClockDurationStaysExact() throws Exception {
        EnduranceStep plank = assertInstanceOf(EnduranceStep.class, step("- plank 99999999999999999999:00"));
        assertEquals("5999999999999999999940", plank.getDuration().getSeconds().toPlainString());
        assertTrue(plank.getDuration().toString().endsWith("min"));
    }
}
