package com.openworkout.owf.serialize;

import com.openworkout.owf.ast.AlternatingEmomStep;
import com.openworkout.owf.ast.AmrapStep;
import com.openworkout.owf.ast.CircuitStep;
import com.openworkout.owf.ast.ContainerStep;
import com.openworkout.owf.ast.CustomIntervalStep;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.ast.DocumentEntry;
import com.openworkout.owf.ast.EmomStep;
import com.openworkout.owf.ast.EnduranceStep;
import com.openworkout.owf.ast.EntryVisitor;
import com.openworkout.owf.ast.ForTimeStep;
import com.openworkout.owf.ast.Heading;
import com.openworkout.owf.ast.HeartRateParameter;
import com.openworkout.owf.ast.IncludeStep;
import com.openworkout.owf.ast.IntensityParameter;
import com.openworkout.owf.ast.PaceParameter;
import com.openworkout.owf.ast.Parameter;
import com.openworkout.owf.ast.ParameterVisitor;
import com.openworkout.owf.ast.PowerParameter;
import com.openworkout.owf.ast.RepeatStep;
import com.openworkout.owf.ast.RestStep;
import com.openworkout.owf.ast.RirParameter;
import com.openworkout.owf.ast.RpeParameter;
import com.openworkout.owf.ast.Session;
import com.openworkout.owf.ast.Step;
import com.openworkout.owf.ast.StepVisitor;
import com.openworkout.owf.ast.StrengthStep;
import com.openworkout.owf.ast.SupersetStep;
import com.openworkout.owf.ast.WeightParameter;
import com.openworkout.owf.ast.Workout;
import com.openworkout.owf.units.DecimalParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a document as canonical text. Headings and container headers are rebuilt from the typed
 * fields, so formatting differences in the source do not survive; parsing the output again yields
 * an equal document.
 */
public final class Serializer {
    private static final String INDENT = "  ";
    private static final ParameterVisitor<String> PARAMETERS = new ParameterWriter();

    private Serializer() {}

    public static String dumps(Document document) {
        List<String> lines = new ArrayList<>();
        Map<String, String> metadata = document.getMetadata();
        if (!metadata.isEmpty()) {
            lines.add("---");
            for (Map.Entry<String, String> entry : metadata.entrySet()) {
                lines.add(entry.getKey() + ": " + entry.getValue());
            }
            lines.add("---");
        }
        List<DocumentEntry> entries = document.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (!lines.isEmpty()) {
                lines.add("");
            }
            entries.get(i).accept(new EntryWriter(lines, i == 0));
        }
        StringBuilder builder = new StringBuilder();
        for (String line : lines) {
            builder.append(line).append('\n');
        }
        return builder.toString();
    }

    public static String formatHeading(Heading heading, String marker) {
        StringBuilder builder = new StringBuilder(marker);
        if (!heading.getName().isEmpty()) {
            builder.append(' ').append(heading.getName());
        }
        if (heading.getModality() != null) {
            builder.append(" [").append(heading.getModality()).append(']');
        }
        if (heading.getDate() != null) {
            builder.append(" (").append(heading.getDate()).append(')');
        }
        if (heading.getRpe() != null) {
            builder.append(" @RPE ").append(DecimalParser.format(heading.getRpe()));
        }
        if (heading.getRir() != null) {
            builder.append(" @RIR ").append(heading.getRir());
        }
        return builder.toString();
    }

    /** Single-line form of a step without its notes or children. */
    public static String formatStep(Step step) {
        return step.accept(new StepLineWriter());
    }

    public static String formatParameter(Parameter parameter) {
        return parameter.accept(PARAMETERS);
    }

    private static boolean isBlank(Heading heading) {
        return heading.getName().isEmpty()
                && heading.getModality() == null
                && heading.getDate() == null
                && heading.getRpe() == null
                && heading.getRir() == null;
    }

    private static void writeSteps(List<String> lines, List<Step> steps, int depth) {
        for (Step step : steps) {
            String indent = INDENT.repeat(depth);
            lines.add(indent + "- " + formatStep(step));
            writeNotes(lines, step.getNotes(), indent);
            if (step instanceof ContainerStep container) {
                writeSteps(lines, container.getChildren(), depth + 1);
            }
        }
    }

    private static void writeNotes(List<String> lines, List<String> notes, String indent) {
        for (String note : notes) {
            lines.add(note.isEmpty() ? indent + ">" : indent + "> " + note);
        }
    }

    /** Heading, blank line, steps, then notes after another blank line. */
    private static void writeBody(
            List<String> lines, String heading, List<Step> steps, List<String> notes) {
        if (heading != null) {
            lines.add(heading);
        }
        if (steps.isEmpty() && notes.isEmpty()) {
            return;
        }
        if (heading != null) {
            lines.add("");
        }
        writeSteps(lines, steps, 0);
        if (!notes.isEmpty()) {
            if (!steps.isEmpty()) {
                lines.add("");
            }
            writeNotes(lines, notes, "");
        }
    }

    private static final class EntryWriter implements EntryVisitor<Void> {
        private final List<String> lines;
        private final boolean first;

        EntryWriter(List<String> lines, boolean first) {
            this.lines = lines;
            this.first = first;
        }

        @Override
        public Void visitWorkout(Workout workout) {
            Heading heading = workout.getHeading();
            String headingLine = first && isBlank(heading) ? null : formatHeading(heading, "#");
            writeBody(lines, headingLine, workout.getSteps(), workout.getNotes());
            return null;
        }

        @Override
        public Void visitSession(Session session) {
            writeBody(lines, formatHeading(session.getHeading(), "##"), session.getSteps(), session.getNotes());
            for (Workout workout : session.getWorkouts()) {
                lines.add("");
                writeBody(lines, formatHeading(workout.getHeading(), "#"), workout.getSteps(), workout.getNotes());
            }
            return null;
        }
    }

    private static final class StepLineWriter implements StepVisitor<String> {
        @Override
        public String visitEndurance(EnduranceStep step) {
            StringJoiner joiner = new StringJoiner(" ");
            joiner.add(step.getAction());
            if (step.getDuration() != null) {
                joiner.add(step.getDuration().toString());
            }
            if (step.getDistance() != null) {
                joiner.add(step.getDistance().toString());
            }
            addParameters(joiner, step.getParameters());
            return joiner.toString();
        }

        @Override
        public String visitStrength(StrengthStep step) {
            StringJoiner joiner = new StringJoiner(" ");
            joiner.add(step.getExercise());
            if (step.getReps() != null) {
                String reps = step.getReps().isMax() ? "max" : step.getReps() + "rep";
                joiner.add(step.getSets() == null ? reps : step.getSets() + "x" + reps);
            }
            if (step.getDuration() != null) {
                joiner.add(step.getDuration().toString());
            }
            addParameters(joiner, step.getParameters());
            if (step.getRest() != null) {
                joiner.add("rest:" + step.getRest());
            }
            return joiner.toString();
        }

        @Override
        public String visitRest(RestStep step) {
            StringJoiner joiner = new StringJoiner(" ");
            joiner.add("rest").add(step.getDuration().toString());
            addParameters(joiner, step.getParameters());
            return joiner.toString();
        }

        @Override
        public String visitInclude(IncludeStep step) {
            return "include: " + step.getWorkoutName();
        }

        @Override
        public String visitRepeat(RepeatStep step) {
            return step.getCount() + "x:";
        }

        @Override
        public String visitSuperset(SupersetStep step) {
            return step.getCount() + "x superset:";
        }

        @Override
        public String visitCircuit(CircuitStep step) {
            return step.getCount() + "x circuit:";
        }

        @Override
        public String visitEmom(EmomStep step) {
            return "emom " + step.getDuration() + ":";
        }

        @Override
        public String visitAlternatingEmom(AlternatingEmomStep step) {
            return "emom " + step.getDuration() + " alternating:";
        }

        @Override
        public String visitCustomInterval(CustomIntervalStep step) {
            return "every " + step.getInterval() + " for " + step.getDuration() + ":";
        }

        @Override
        public String visitAmrap(AmrapStep step) {
            return "amrap " + step.getDuration() + ":";
        }

        @Override
        public String visitForTime(ForTimeStep step) {
            return step.getTimeCap() == null ? "for-time:" : "for-time " + step.getTimeCap() + ":";
        }

        private static void addParameters(StringJoiner joiner, List<Parameter> parameters) {
            for (Parameter parameter : parameters) {
                joiner.add(formatParameter(parameter));
            }
        }
    }

    private static final class ParameterWriter implements ParameterVisitor<String> {
        @Override
        public String visitPace(PaceParameter parameter) {
            return "@" + parameter.getPace();
        }

        @Override
        public String visitPower(PowerParameter parameter) {
            return "@" + ExpressionFormatter.format(parameter.getValue());
        }

        @Override
        public String visitWeight(WeightParameter parameter) {
            return "@" + ExpressionFormatter.format(parameter.getValue());
        }

        @Override
        public String visitHeartRate(HeartRateParameter parameter) {
            return "@" + (parameter.isZone() ? parameter.getZone() : ExpressionFormatter.format(parameter.getValue()));
        }

        @Override
        public String visitRpe(RpeParameter parameter) {
            return "@RPE " + DecimalParser.format(parameter.getValue());
        }

        @Override
        public String visitRir(RirParameter parameter) {
            return "@RIR " + parameter.getValue();
        }

        @Override
        public String visitIntensity(IntensityParameter parameter) {
            return "@" + parameter.getName();
        }
    }
}
