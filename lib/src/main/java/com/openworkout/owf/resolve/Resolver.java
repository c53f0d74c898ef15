package com.openworkout.owf.resolve;

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
import com.openworkout.owf.ast.SourceLocation;
import com.openworkout.owf.ast.Step;
import com.openworkout.owf.ast.StepVisitor;
import com.openworkout.owf.ast.StrengthStep;
import com.openworkout.owf.ast.SupersetStep;
import com.openworkout.owf.ast.VariableReference;
import com.openworkout.owf.ast.WeightParameter;
import com.openworkout.owf.ast.Workout;
import com.openworkout.owf.parser.Grammar;
import com.openworkout.owf.serialize.ExpressionFormatter;
import com.openworkout.owf.units.DecimalParser;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces every expression in a document with a concrete literal, looking variables up in a
 * caller-supplied map. Variable values are written {@code <number><unit>}, e.g. {@code 250W} or
 * {@code 100 kg}. The document's own frontmatter is not consulted.
 */
public final class Resolver {
    private static final Pattern VARIABLE_VALUE =
            Pattern.compile("\\s*(\\d+(?:\\.\\d+)?)\\s*([A-Za-z%]*)\\s*");

    private final Map<String, String> variables;

    public Resolver(Map<String, String> variables) {
        this.variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    }

    public Document resolve(Document document) throws OwfResolveException {
        try {
            List<DocumentEntry> entries = new ArrayList<>();
            for (DocumentEntry entry : document.getEntries()) {
                entries.add(entry.accept(new EntryResolver()));
            }
            return document.withEntries(entries);
        } catch (ResolutionFailure failure) {
            throw new OwfResolveException(failure.location, failure.getMessage());
        }
    }

    /** Resolves a single expression to a literal. */
    public LiteralExpression resolve(Expression expression) throws OwfResolveException {
        try {
            return value(expression, new ExpressionResolver());
        } catch (ResolutionFailure failure) {
            throw new OwfResolveException(failure.location, failure.getMessage());
        }
    }

    private List<Step> resolveSteps(List<Step> steps) {
        List<Step> resolved = new ArrayList<>(steps.size());
        StepResolver stepResolver = new StepResolver();
        for (Step step : steps) {
            resolved.add(step.accept(stepResolver));
        }
        return resolved;
    }

    private List<Parameter> resolveParameters(List<Parameter> parameters) {
        List<Parameter> resolved = new ArrayList<>(parameters.size());
        ParameterResolver parameterResolver = new ParameterResolver();
        for (Parameter parameter : parameters) {
            resolved.add(parameter.accept(parameterResolver));
        }
        return resolved;
    }

    /** Resolves a whole parameter value; the result must not be negative. */
    private static LiteralExpression value(Expression expression, ExpressionResolver resolver) {
        LiteralExpression literal = expression.accept(resolver);
        if (literal.getValue().signum() < 0) {
            throw new ResolutionFailure(
                    expression.getLocation(),
                    "'"
                            + ExpressionFormatter.format(expression)
                            + "' resolves to a negative value: "
                            + literal);
        }
        return literal;
    }

    private final class EntryResolver implements EntryVisitor<DocumentEntry> {
        @Override
        public DocumentEntry visitWorkout(Workout workout) {
            return workout.withSteps(resolveSteps(workout.getSteps()));
        }

        @Override
        public DocumentEntry visitSession(Session session) {
            List<Workout> workouts = new ArrayList<>();
            for (Workout workout : session.getWorkouts()) {
                workouts.add(workout.withSteps(resolveSteps(workout.getSteps())));
            }
            return session.withContent(resolveSteps(session.getSteps()), workouts);
        }
    }

    private final class StepResolver implements StepVisitor<Step> {
        @Override
        public Step visitEndurance(EnduranceStep step) {
            return step.withParameters(resolveParameters(step.getParameters()));
        }

        @Override
        public Step visitStrength(StrengthStep step) {
            return step.withParameters(resolveParameters(step.getParameters()));
        }

        @Override
        public Step visitRest(RestStep step) {
            return step.withParameters(resolveParameters(step.getParameters()));
        }

        @Override
        public Step visitInclude(IncludeStep step) {
            return step;
        }

        @Override
        public Step visitRepeat(RepeatStep step) {
            return container(step);
        }

        @Override
        public Step visitSuperset(SupersetStep step) {
            return container(step);
        }

        @Override
        public Step visitCircuit(CircuitStep step) {
            return container(step);
        }

        @Override
        public Step visitEmom(EmomStep step) {
            return container(step);
        }

        @Override
        public Step visitAlternatingEmom(AlternatingEmomStep step) {
            return container(step);
        }

        @Override
        public Step visitCustomInterval(CustomIntervalStep step) {
            return container(step);
        }

        @Override
        public Step visitAmrap(AmrapStep step) {
            return container(step);
        }

        @Override
        public Step visitForTime(ForTimeStep step) {
            return container(step);
        }

        private Step container(ContainerStep step) {
            return step.withChildren(resolveSteps(step.getChildren()));
        }
    }

    private final class ParameterResolver implements ParameterVisitor<Parameter> {
        private final ExpressionResolver expressions = new ExpressionResolver();

        @Override
        public Parameter visitPace(PaceParameter parameter) {
            return parameter;
        }

        @Override
        public Parameter visitPower(PowerParameter parameter) {
            return parameter.withValue(value(parameter.getValue(), expressions));
        }

        @Override
        public Parameter visitWeight(WeightParameter parameter) {
            return parameter.withValue(value(parameter.getValue(), expressions));
        }

        @Override
        public Parameter visitHeartRate(HeartRateParameter parameter) {
            if (parameter.isZone()) {
                return parameter;
            }
            return parameter.withValue(value(parameter.getValue(), expressions));
        }

        @Override
        public Parameter visitRpe(RpeParameter parameter) {
            return parameter;
        }

        @Override
        public Parameter visitRir(RirParameter parameter) {
            return parameter;
        }

        @Override
        public Parameter visitIntensity(IntensityParameter parameter) {
            return parameter;
        }
    }

    private final class ExpressionResolver implements ExpressionVisitor<LiteralExpression> {
        @Override
        public LiteralExpression visitLiteral(LiteralExpression literal) {
            return literal;
        }

        @Override
        public LiteralExpression visitVariable(VariableReference variable) {
            String raw = variables.get(variable.getName());
            if (raw == null) {
                throw new ResolutionFailure(
                        variable.getLocation(), "Undefined variable '" + variable.getName() + "'");
            }
            Matcher matcher = VARIABLE_VALUE.matcher(raw);
            if (!matcher.matches()) {
                throw new ResolutionFailure(
                        variable.getLocation(),
                        "Cannot parse value '" + raw + "' of variable '" + variable.getName() + "'");
            }
            String unit = matcher.group(2);
            if (!unit.isEmpty() && Grammar.canonicalUnit(unit) != null) {
                unit = Grammar.canonicalUnit(unit);
            }
            return new LiteralExpression(
                    variable.getLocation(), DecimalParser.parse(matcher.group(1)), unit);
        }

        @Override
        public LiteralExpression visitPercentage(PercentageOf percentage) {
            LiteralExpression base = percentage.getBase().accept(this);
            BigDecimal value = base.getValue().multiply(percentage.getPercentage()).movePointLeft(2);
            return new LiteralExpression(percentage.getLocation(), value, base.getUnit());
        }

        @Override
        public LiteralExpression visitBinary(BinaryOperation operation) {
            LiteralExpression left = operation.getLeft().accept(this);
            LiteralExpression right = operation.getRight().accept(this);
            String unit;
            if (!left.hasUnit()) {
                unit = right.getUnit();
            } else if (!right.hasUnit() || left.getUnit().equals(right.getUnit())) {
                unit = left.getUnit();
            } else {
                throw new ResolutionFailure(
                        operation.getLocation(),
                        "Incompatible units: '"
                                + left
                                + "' "
                                + operation.getOperator().getSymbol()
                                + " '"
                                + right
                                + "'");
            }
            BigDecimal value =
                    operation.getOperator() == BinaryOperation.Operator.PLUS
                            ? left.getValue().add(right.getValue())
                            : left.getValue().subtract(right.getValue());
            return new LiteralExpression(operation.getLocation(), value, unit);
        }
    }

    /** Unwinds the visitors on the first failure; converted to {@link OwfResolveException}. */
    private static final class ResolutionFailure extends RuntimeException {
        private final SourceLocation location;

        ResolutionFailure(SourceLocation location, String message) {
            super(message);
            this.location = location;
        }
    }
}
