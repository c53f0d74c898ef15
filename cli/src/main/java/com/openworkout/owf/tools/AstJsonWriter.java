package com.openworkout.owf.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openworkout.owf.ast.AlternatingEmomStep;
import com.openworkout.owf.ast.AmrapStep;
import com.openworkout.owf.ast.BinaryOperation;
import com.openworkout.owf.ast.CircuitStep;
import com.openworkout.owf.ast.ContainerStep;
import com.openworkout.owf.ast.CustomIntervalStep;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.ast.DocumentEntry;
import com.openworkout.owf.ast.EmomStep;
import com.openworkout.owf.ast.EnduranceStep;
import com.openworkout.owf.ast.EntryVisitor;
import com.openworkout.owf.ast.Expression;
import com.openworkout.owf.ast.ExpressionVisitor;
import com.openworkout.owf.ast.ForTimeStep;
import com.openworkout.owf.ast.Heading;
import com.openworkout.owf.ast.HeartRateParameter;
import com.openworkout.owf.ast.IncludeStep;
import com.openworkout.owf.ast.IntensityParameter;
import com.openworkout.owf.ast.LiteralExpression;
import com.openworkout.owf.ast.PaceParameter;
import com.openworkout.owf.ast.Parameter;
import com.openworkout.owf.ast.ParameterVisitor;
import com.openworkout.owf.ast.PercentageOf;
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
import com.openworkout.owf.ast.VariableReference;
import com.openworkout.owf.ast.WeightParameter;
import com.openworkout.owf.ast.Workout;
import com.openworkout.owf.ast.WorkoutDate;
import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Map;

/**
 * Renders a document as a JSON tree. Every node carries a {@code "type"} discriminator; source
 * locations are left out. Durations, distances and paces are written in their canonical text form.
 */
public final class AstJsonWriter {
    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private AstJsonWriter() {}

    public static String write(Document document) {
        try {
            return MAPPER.writeValueAsString(toJson(document));
        } catch (JsonProcessingException e) {
            // A tree of plain nodes always serializes.
            throw new IllegalStateException("Failed to render document as JSON", e);
        }
    }

    public static ObjectNode toJson(Document document) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", "Document");
        ObjectNode metadata = root.putObject("metadata");
        for (Map.Entry<String, String> entry : document.getMetadata().entrySet()) {
            metadata.put(entry.getKey(), entry.getValue());
        }
        ArrayNode entries = root.putArray("entries");
        EntryWriter writer = new EntryWriter();
        for (DocumentEntry entry : document.getEntries()) {
            entries.add(entry.accept(writer));
        }
        return root;
    }

    private static ObjectNode node(String type) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        return node;
    }

    private static void putDuration(ObjectNode node, String field, Duration duration) {
        if (duration != null) {
            node.put(field, duration.toString());
        }
    }

    private static void putNotes(ObjectNode node, List<String> notes) {
        ArrayNode array = node.putArray("notes");
        for (String note : notes) {
            array.add(note);
        }
    }

    private static void putSteps(ObjectNode node, String field, List<Step> steps) {
        ArrayNode array = node.putArray(field);
        for (Step step : steps) {
            array.add(step.accept(StepWriter.INSTANCE));
        }
    }

    private static void putParameters(ObjectNode node, List<Parameter> parameters) {
        ArrayNode array = node.putArray("parameters");
        for (Parameter parameter : parameters) {
            array.add(parameter.accept(ParameterWriter.INSTANCE));
        }
    }

    private static ObjectNode heading(Heading heading) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", heading.getName());
        if (heading.getModality() != null) {
            node.put("modality", heading.getModality());
        }
        WorkoutDate date = heading.getDate();
        if (date != null) {
            node.put("date", date.getDate().toString());
            if (date.getStartTime() != null) {
                node.put("start", date.getStartTime().toString());
            }
            if (date.getEndTime() != null) {
                node.put("end", date.getEndTime().toString());
            }
        }
        if (heading.getRpe() != null) {
            node.put("rpe", heading.getRpe());
        }
        if (heading.getRir() != null) {
            node.put("rir", heading.getRir());
        }
        return node;
    }

    private static final class EntryWriter implements EntryVisitor<ObjectNode> {
        @Override
        public ObjectNode visitWorkout(Workout workout) {
            ObjectNode node = node("Workout");
            node.set("heading", heading(workout.getHeading()));
            putSteps(node, "steps", workout.getSteps());
            putNotes(node, workout.getNotes());
            return node;
        }

        @Override
        public ObjectNode visitSession(Session session) {
            ObjectNode node = node("Session");
            node.set("heading", heading(session.getHeading()));
            if (session.getModality() != null) {
                node.put("modality", session.getModality());
            }
            putSteps(node, "steps", session.getSteps());
            ArrayNode workouts = node.putArray("workouts");
            for (Workout workout : session.getWorkouts()) {
                workouts.add(visitWorkout(workout));
            }
            putNotes(node, session.getNotes());
            return node;
        }
    }

    private static final class StepWriter implements StepVisitor<ObjectNode> {
        static final StepWriter INSTANCE = new StepWriter();

        @Override
        public ObjectNode visitEndurance(EnduranceStep step) {
            ObjectNode node = node("EnduranceStep");
            node.put("action", step.getAction());
            putDuration(node, "duration", step.getDuration());
            if (step.getDistance() != null) {
                node.put("distance", step.getDistance().toString());
            }
            return leaf(node, step);
        }

        @Override
        public ObjectNode visitStrength(StrengthStep step) {
            ObjectNode node = node("StrengthStep");
            node.put("exercise", step.getExercise());
            if (step.getSets() != null) {
                node.put("sets", step.getSets());
            }
            if (step.getReps() != null) {
                if (step.getReps().isMax()) {
                    node.put("reps", "max");
                } else {
                    node.put("reps", step.getReps().getCount());
                }
            }
            putDuration(node, "duration", step.getDuration());
            putDuration(node, "rest", step.getRest());
            return leaf(node, step);
        }

        @Override
        public ObjectNode visitRest(RestStep step) {
            ObjectNode node = node("RestStep");
            putDuration(node, "duration", step.getDuration());
            return leaf(node, step);
        }

        @Override
        public ObjectNode visitInclude(IncludeStep step) {
            ObjectNode node = node("IncludeStep");
            node.put("workout", step.getWorkoutName());
            putNotes(node, step.getNotes());
            return node;
        }

        @Override
        public ObjectNode visitRepeat(RepeatStep step) {
            ObjectNode node = node("RepeatStep");
            node.put("count", step.getCount());
            return container(node, step);
        }

        @Override
        public ObjectNode visitSuperset(SupersetStep step) {
            ObjectNode node = node("SupersetStep");
            node.put("count", step.getCount());
            return container(node, step);
        }

        @Override
        public ObjectNode visitCircuit(CircuitStep step) {
            ObjectNode node = node("CircuitStep");
            node.put("count", step.getCount());
            return container(node, step);
        }

        @Override
        public ObjectNode visitEmom(EmomStep step) {
            ObjectNode node = node("EmomStep");
            putDuration(node, "duration", step.getDuration());
            return container(node, step);
        }

        @Override
        public ObjectNode visitAlternatingEmom(AlternatingEmomStep step) {
            ObjectNode node = node("AlternatingEmomStep");
            putDuration(node, "duration", step.getDuration());
            return container(node, step);
        }

        @Override
        public ObjectNode visitCustomInterval(CustomIntervalStep step) {
            ObjectNode node = node("CustomIntervalStep");
            putDuration(node, "interval", step.getInterval());
            putDuration(node, "duration", step.getDuration());
            return container(node, step);
        }

        @Override
        public ObjectNode visitAmrap(AmrapStep step) {
            ObjectNode node = node("AmrapStep");
            putDuration(node, "duration", step.getDuration());
            return container(node, step);
        }

        @Override
        public ObjectNode visitForTime(ForTimeStep step) {
            ObjectNode node = node("ForTimeStep");
            putDuration(node, "timeCap", step.getTimeCap());
            return container(node, step);
        }

        private static ObjectNode leaf(ObjectNode node, Step step) {
            putParameters(node, step.getParameters());
            putNotes(node, step.getNotes());
            return node;
        }

        private static ObjectNode container(ObjectNode node, ContainerStep step) {
            putSteps(node, "children", step.getChildren());
            putNotes(node, step.getNotes());
            return node;
        }
    }

    private static final class ParameterWriter implements ParameterVisitor<ObjectNode> {
        static final ParameterWriter INSTANCE = new ParameterWriter();

        @Override
        public ObjectNode visitPace(PaceParameter parameter) {
            ObjectNode node = node("PaceParameter");
            node.put("pace", parameter.getPace().toString());
            return node;
        }

        @Override
        public ObjectNode visitPower(PowerParameter parameter) {
            return withValue(node("PowerParameter"), parameter.getValue());
        }

        @Override
        public ObjectNode visitWeight(WeightParameter parameter) {
            return withValue(node("WeightParameter"), parameter.getValue());
        }

        @Override
        public ObjectNode visitHeartRate(HeartRateParameter parameter) {
            ObjectNode node = node("HeartRateParameter");
            if (parameter.isZone()) {
                node.put("zone", parameter.getZone());
                return node;
            }
            return withValue(node, parameter.getValue());
        }

        @Override
        public ObjectNode visitRpe(RpeParameter parameter) {
            ObjectNode node = node("RpeParameter");
            node.put("value", parameter.getValue());
            return node;
        }

        @Override
        public ObjectNode visitRir(RirParameter parameter) {
            ObjectNode node = node("RirParameter");
            node.put("value", parameter.getValue());
            return node;
        }

        @Override
        public ObjectNode visitIntensity(IntensityParameter parameter) {
            ObjectNode node = node("IntensityParameter");
            node.put("name", parameter.getName());
            return node;
        }

        private static ObjectNode withValue(ObjectNode node, Expression value) {
            node.set("value", value.accept(ExpressionWriter.INSTANCE));
            return node;
        }
    }

    private static final class ExpressionWriter implements ExpressionVisitor<ObjectNode> {
        static final ExpressionWriter INSTANCE = new ExpressionWriter();

        @Override
        public ObjectNode visitLiteral(LiteralExpression literal) {
            ObjectNode node = node("Literal");
            node.put("value", literal.getValue());
            if (literal.hasUnit()) {
                node.put("unit", literal.getUnit());
            }
            return node;
        }

        @Override
        public ObjectNode visitVariable(VariableReference variable) {
            ObjectNode node = node("Variable");
            node.put("name", variable.getName());
            return node;
        }

        @Override
        public ObjectNode visitPercentage(PercentageOf percentage) {
            ObjectNode node = node("PercentageOf");
            node.put("percentage", percentage.getPercentage());
            node.set("base", percentage.getBase().accept(this));
            return node;
        }

        @Override
        public ObjectNode visitBinary(BinaryOperation operation) {
            ObjectNode node = node("BinaryOperation");
            node.put("operator", operation.getOperator().getSymbol());
            node.set("left", operation.getLeft().accept(this));
            node.set("right", operation.getRight().accept(this));
            return node;
        }
    }
}
