package com.openworkout.owf.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.openworkout.owf.ast.AmrapStep;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.ast.EnduranceStep;
import com.openworkout.owf.ast.ForTimeStep;
import com.openworkout.owf.ast.RepeatStep;
import com.openworkout.owf.ast.Session;
import com.openworkout.owf.ast.SupersetStep;
import com.openworkout.owf.ast.Workout;
import com.openworkout.owf.testing.TestResources;
import com.openworkout.owf.units.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

final class DocumentParserTest {

    private static Document parse(String text) throws OwfParseException {
        return new DocumentParser("test.owf").parse(text);
    }

    @Test
    void parsesFullExample() throws Exception {
        Document document = new DocumentParser("full.owf").parse(TestResources.read("examples/full.owf"));
        assertEquals(7, document.getEntries().size());
        assertEquals("250W", document.getMetadata().get("FTP"));
        assertEquals("100kg", document.getMetadata().get("1RM bench press"));
        assertEquals("185bpm", document.getMetadata().get("max HR"));
        assertEquals(
                List.of("FTP", "1RM bench press", "bodyweight", "max HR"),
                List.copyOf(document.getMetadata().keySet()));

        Workout ride = assertInstanceOf(Workout.class, document.getEntries().get(0));
        assertEquals("Threshold Ride", ride.getName());
        assertEquals("bike", ride.getHeading().getModality());
        assertEquals(3, ride.getSteps().size());
        EnduranceStep warmup = assertInstanceOf(EnduranceStep.class, ride.getSteps().get(0));
        assertEquals(Duration.ofSeconds(900), warmup.getDuration());
        RepeatStep intervals = assertInstanceOf(RepeatStep.class, ride.getSteps().get(1));
        assertEquals(5, intervals.getCount());
        assertEquals(2, intervals.getChildren().size());
        assertEquals(List.of("Felt strong through set 3, faded on 4-5."), ride.getNotes());

        Workout upper = assertInstanceOf(Workout.class, document.getEntries().get(1));
        assertEquals(3, assertInstanceOf(SupersetStep.class, upper.getSteps().get(0)).getCount());

        Workout murph = assertInstanceOf(Workout.class, document.getEntries().get(5));
        assertEquals(5, assertInstanceOf(ForTimeStep.class, murph.getSteps().get(0)).getChildren().size());
        Workout metcon = assertInstanceOf(Workout.class, document.getEntries().get(6));
        assertInstanceOf(AmrapStep.class, metcon.getSteps().get(0));
    }

    @Test
    void parsesSessionExample() throws Exception {
        Document document = parse(TestResources.read("examples/session.owf"));
        assertEquals(1, document.getEntries().size());
        Session session = assertInstanceOf(Session.class, document.getEntries().get(0));
        assertEquals("Saturday Training", session.getName());
        assertEquals(1, session.getSteps().size());
        assertEquals(2, session.getWorkouts().size());
        assertEquals("mixed", session.getModality());
        assertTrue(session.isModalityInferred());
        Workout upper = session.getWorkouts().get(1);
        assertEquals(List.of("Great session overall."), upper.getNotes());
        assertTrue(session.getNotes().isEmpty());
    }

    @Test
    void workoutsBeforeFirstSessionStayTopLevel() throws Exception {
        Document document =
                parse(String.join("\n", "# Warmup", "- run 1km", "## Day [run]", "# A", "- run 5km", "## Next", "# B", "- run 2km"));
        assertEquals(3, document.getEntries().size());
        assertInstanceOf(Workout.class, document.getEntries().get(0));
        Session day = assertInstanceOf(Session.class, document.getEntries().get(1));
        assertEquals("run", day.getModality());
        assertFalse(day.isModalityInferred());
        assertEquals("A", day.getWorkouts().get(0).getName());
        Session next = assertInstanceOf(Session.class, document.getEntries().get(2));
        assertEquals("B", next.getWorkouts().get(0).getName());
        assertNull(next.getModality());
        assertEquals(3, document.getAllWorkouts().size());
    }

    @Test
    void preambleBecomesAnonymousWorkout() throws Exception {
        Document document = parse("- run 5km @easy\n> go slow\n\n# Named\n- bike 5min");
        assertEquals(2, document.getEntries().size());
        Workout anonymous = assertInstanceOf(Workout.class, document.getEntries().get(0));
        assertEquals("", anonymous.getName());
        assertEquals(List.of("go slow"), anonymous.getSteps().get(0).getNotes());
    }

    @Test
    void dropsEmptyWorkouts() throws Exception {
        Document document = parse("\n\n#\n\n# Real\n- run 1km\n");
        assertEquals(1, document.getEntries().size());
        assertEquals("Real", document.getAllWorkouts().get(0).getName());
        assertTrue(parse("").getEntries().isEmpty());
    }

    @Test
    void namedWorkoutWithoutStepsIsKept() throws Exception {
        Document document = parse("# Rest Day\n\n> walk the dog");
        Workout workout = assertInstanceOf(Workout.class, document.getEntries().get(0));
        assertTrue(workout.getSteps().isEmpty());
        assertEquals(List.of("walk the dog"), workout.getNotes());
    }

    @Test
    void frontmatterMustBeClosed() {
        OwfParseException ex = assertThrows(OwfParseException.class, () -> parse("\n---\nFTP: 250W\n# Ride"));
        assertTrue(ex.getReason().startsWith("Unclosed frontmatter"));
        assertEquals(2, ex.getLocation().getLine());
    }

    @Test
    void rejectsMalformedFrontmatterLine() {
        OwfParseException ex = assertThrows(OwfParseException.class, () -> parse("---\nFTP 250W\n---\n"));
        assertEquals("test.owf:2:1: Invalid frontmatter line: 'FTP 250W'", ex.getMessage());
    }

    @Test
    void fenceAfterContentIsAnError() {
        assertThrows(OwfParseException.class, () -> parse("# Ride\n- bike 5min\n---\nFTP: 250W\n---"));
    }

    @Test
    void errorsCarrySourceName() {
        OwfParseException ex =
                assertThrows(OwfParseException.class, () -> new DocumentParser("plan.owf").parse("# W\n- 3x:\n"));
        assertEquals("plan.owf", ex.getLocation().getSourceName());
        assertTrue(ex.getMessage().startsWith("plan.owf:2:1: "));
    }
}
