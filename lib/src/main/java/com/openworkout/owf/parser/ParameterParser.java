package com.openworkout.owf.parser;

import com.openworkout.owf.ast.BinaryOperation;
import com.openworkout.owf.ast.Expression;
import com.openworkout.owf.ast.HeartRateParameter;
import com.openworkout.owf.ast.IntensityParameter;
import com.openworkout.owf.ast.LiteralExpression;
import com.openworkout.owf.ast.PaceParameter;
import com.openworkout.owf.ast.Parameter;
import com.openworkout.owf.ast.PercentageOf;
import com.openworkout.owf.ast.PowerParameter;
import com.openworkout.owf.ast.RirParameter;
import com.openworkout.owf.ast.RpeParameter;
import com.openworkout.owf.ast.SourceLocation;
import com.openworkout.owf.ast.VariableReference;
import com.openworkout.owf.ast.WeightParameter;
import com.openworkout.owf.units.DecimalParser;
import com.openworkout.owf.units.Pace;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a step's tail into {@code @} segments and classifies each one: pace, named intensity,
 * RPE, RIR, heart-rate zone, and finally a typed expression.
 */
final class ParameterParser {
    private static final Pattern RPE =
            Pattern.compile("rpe\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RIR = Pattern.compile("rir\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ZONE = Pattern.compile("z(\\d)", Pattern.CASE_INSENSITIVE);
    private static final String PACE_PREFIX = "pace:";

    private ParameterParser() {}

    static List<Parameter> parse(ScannedLine line, List<LineToken> tail) throws OwfParseException {
        List<Parameter> parameters = new ArrayList<>();
        int index = 0;
        while (index < tail.size()) {
            LineToken marker = tail.get(index);
            if (!marker.startsWith('@')) {
                throw new OwfParseException(
                        line.locationAt(marker.getColumn()),
                        "Expected a parameter starting with '@' but found '" + marker.getText() + "'");
            }
            List<LineToken> segment = new ArrayList<>();
            if (marker.getText().length() > 1) {
                segment.add(new LineToken(marker.getText().substring(1), marker.getColumn() + 1));
            }
            index++;
            while (index < tail.size() && !tail.get(index).startsWith('@')) {
                segment.add(tail.get(index++));
            }
            SourceLocation location = line.locationAt(marker.getColumn());
            if (segment.isEmpty()) {
                throw new OwfParseException(location, "Empty parameter '@'");
            }
            parameters.add(classify(line, location, segment));
        }
        return parameters;
    }

    private static Parameter classify(ScannedLine line, SourceLocation location, List<LineToken> segment)
            throws OwfParseException {
        String text = LineTokenizer.join(segment);
        String lower = text.toLowerCase(Locale.ROOT);

        if (lower.startsWith(PACE_PREFIX)) {
            Pace pace = pace(text.substring(PACE_PREFIX.length()).strip(), location);
            if (pace == null) {
                throw new OwfParseException(location, "Invalid pace '" + text + "'");
            }
            return new PaceParameter(location, pace);
        }
        Pace pace = pace(text, location);
        if (pace != null) {
            return new PaceParameter(location, pace);
        }
        if (Grammar.INTENSITIES.contains(lower)) {
            return new IntensityParameter(location, lower);
        }
        Matcher matcher = RPE.matcher(text);
        if (matcher.matches()) {
            return new RpeParameter(location, DecimalParser.parse(matcher.group(1)));
        }
        matcher = RIR.matcher(text);
        if (matcher.matches()) {
            return new RirParameter(location, Numbers.toInt(matcher.group(1), location, "@RIR value"));
        }
        matcher = ZONE.matcher(text);
        if (matcher.matches()) {
            return HeartRateParameter.ofZone(location, "Z" + matcher.group(1));
        }
        Expression expression = ExpressionParser.parse(line, segment);
        return switch (kindOf(expression)) {
            case POWER -> new PowerParameter(location, expression);
            case WEIGHT -> new WeightParameter(location, expression);
            case HEART_RATE -> HeartRateParameter.ofExpression(location, expression);
        };
    }

    enum TargetKind {
        POWER,
        WEIGHT,
        HEART_RATE
    }

    /** Decides which parameter family an expression belongs to from its shape and units. */
    static TargetKind kindOf(Expression expression) {
        if (expression instanceof LiteralExpression literal) {
            return literalKind(literal);
        }
        List<Expression> leaves = new ArrayList<>();
        collectLeaves(expression, leaves);
        if (expression instanceof PercentageOf) {
            if (anyVariable(leaves, Grammar.HEART_RATE_WORDS)) {
                return TargetKind.HEART_RATE;
            }
            if (anyVariable(leaves, Grammar.POWER_WORDS) || anyUnit(leaves, Grammar.POWER_UNIT)) {
                return TargetKind.POWER;
            }
            if (anyUnit(leaves, Grammar.HEART_RATE_UNIT)) {
                return TargetKind.HEART_RATE;
            }
            return TargetKind.WEIGHT;
        }
        if (expression instanceof BinaryOperation) {
            if (anyUnit(leaves, Grammar.POWER_UNIT)) {
                return TargetKind.POWER;
            }
            for (String unit : Grammar.WEIGHT_UNITS) {
                if (anyUnit(leaves, unit)) {
                    return TargetKind.WEIGHT;
                }
            }
            if (anyUnit(leaves, Grammar.HEART_RATE_UNIT)) {
                return TargetKind.HEART_RATE;
            }
            boolean allNames = true;
            for (Expression leaf : leaves) {
                allNames &= leaf instanceof VariableReference;
            }
            return allNames ? TargetKind.POWER : TargetKind.WEIGHT;
        }
        return anyVariable(leaves, Grammar.HEART_RATE_WORDS) ? TargetKind.HEART_RATE : TargetKind.POWER;
    }

    private static Pace pace(String text, SourceLocation location) throws OwfParseException {
        try {
            return Pace.tryParse(text);
        } catch (IllegalArgumentException ex) {
            throw new OwfParseException(location, "Invalid pace '" + text + "': " + ex.getMessage(), ex);
        }
    }

    private static TargetKind literalKind(LiteralExpression literal) {
        String unit = literal.getUnit();
        if (unit == null || Grammar.POWER_UNIT.equals(unit)) {
            return TargetKind.POWER;
        }
        if (Grammar.WEIGHT_UNITS.contains(unit) || Grammar.HEIGHT_UNIT.equals(unit)) {
            return TargetKind.WEIGHT;
        }
        if (Grammar.HEART_RATE_UNIT.equals(unit)) {
            return TargetKind.HEART_RATE;
        }
        return TargetKind.POWER;
    }

    private static void collectLeaves(Expression expression, List<Expression> leaves) {
        if (expression instanceof PercentageOf percentage) {
            collectLeaves(percentage.getBase(), leaves);
        } else if (expression instanceof BinaryOperation operation) {
            collectLeaves(operation.getLeft(), leaves);
            collectLeaves(operation.getRight(), leaves);
        } else {
            leaves.add(expression);
        }
    }

    private static boolean anyVariable(List<Expression> leaves, Set<String> words) {
        for (Expression leaf : leaves) {
            if (leaf instanceof VariableReference variable) {
                for (String word : variable.getName().toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
                    if (words.contains(word)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static boolean anyUnit(List<Expression> leaves, String unit) {
        for (Expression leaf : leaves) {
            if (leaf instanceof LiteralExpression literal && unit.equals(literal.getUnit())) {
                return true;
            }
        }
        return false;
    }
}
