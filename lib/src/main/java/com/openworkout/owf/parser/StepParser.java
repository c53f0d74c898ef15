package com.openworkout.owf.parser;

import com.openworkout.owf.ast.AlternatingEmomStep;
import com.openworkout.owf.ast.AmrapStep;
import com.openworkout.owf.ast.CircuitStep;
import com.openworkout.owf.ast.CustomIntervalStep;
import com.openworkout.owf.ast.EmomStep;
import com.openworkout.owf.ast.EnduranceStep;
import com.openworkout.owf.ast.ForTimeStep;
import com.openworkout.owf.ast.IncludeStep;
import com.openworkout.owf.ast.Parameter;
import com.openworkout.owf.ast.RepeatStep;
import com.openworkout.owf.ast.Reps;
import com.openworkout.owf.ast.RestStep;
import com.openworkout.owf.ast.SourceLocation;
import com.openworkout.owf.ast.Step;
import com.openworkout.owf.ast.StrengthStep;
import com.openworkout.owf.ast.SupersetStep;
import com.openworkout.owf.units.Distance;
import com.openworkout.owf.units.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one step block (and, for containers, its nested blocks) into a typed {@link Step}.
 *
 * <p>Recognition order: {@code include:}, container headers (content ending in {@code :}),
 * {@code rest <duration>}, endurance actions, and strength exercises as the fallback.</p>
 */
final class StepParser {
    private static final String INCLUDE_PREFIX = "include:";
    private static final String REST_PREFIX = "rest:";

    private static final Pattern EMOM_ALTERNATING =
            Pattern.compile("emom\\s+(\\S+)\\s+alternating\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMOM = Pattern.compile("emom\\s+(\\S+)\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVERY =
            Pattern.compile("every\\s+(\\S+)\\s+for\\s+(\\S+)\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern AMRAP = Pattern.compile("amrap\\s+(\\S+)\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOR_TIME =
            Pattern.compile("for-time(?:\\s+(\\S+))?\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUPERSET =
            Pattern.compile("(\\d+)x\\s+superset\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern CIRCUIT =
            Pattern.compile("(\\d+)x\\s+circuit\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPEAT = Pattern.compile("(\\d+)x\\s*:", Pattern.CASE_INSENSITIVE);

    private StepParser() {}

    static List<Step> parseAll(List<RawBlock> blocks) throws OwfParseException {
        List<Step> steps = new ArrayList<>(blocks.size());
        for (RawBlock block : blocks) {
            steps.add(parse(block));
        }
        return steps;
    }

    static Step parse(RawBlock block) throws OwfParseException {
        ScannedLine line = block.getLine();
        String content = line.getContent();
        SourceLocation location = line.getLocation();
        if (content.isEmpty()) {
            throw new OwfParseException(location, "Empty step");
        }
        if (content.toLowerCase(Locale.ROOT).startsWith(INCLUDE_PREFIX)) {
            String name = content.substring(INCLUDE_PREFIX.length()).strip();
            if (name.isEmpty()) {
                throw new OwfParseException(location, "include: needs a workout name");
            }
            rejectChildren(block);
            return new IncludeStep(location, name, block.getNotes());
        }
        if (content.endsWith(":")) {
            return parseContainer(block, content, location);
        }
        rejectChildren(block);

        List<LineToken> tokens = LineTokenizer.tokenize(content, line.getContentColumn());
        int headEnd = 0;
        while (headEnd < tokens.size() && !isTailStart(tokens.get(headEnd))) {
            headEnd++;
        }
        List<LineToken> head = tokens.subList(0, headEnd);
        List<LineToken> tail = tokens.subList(headEnd, tokens.size());
        if (head.isEmpty()) {
            throw new OwfParseException(location, "Step has no name");
        }
        String first = head.get(0).getText().toLowerCase(Locale.ROOT);
        if (first.equals("rest") && head.size() == 2) {
            Duration duration = Duration.tryParse(head.get(1).getText());
            if (duration != null) {
                return new RestStep(location, duration, parameters(line, tail, false), block.getNotes());
            }
        }
        if (Grammar.ENDURANCE_ACTIONS.contains(first)) {
            return parseEndurance(block, head, tail);
        }
        return parseStrength(block, head, tail);
    }

    private static boolean isTailStart(LineToken token) {
        return token.startsWith('@') || token.getText().toLowerCase(Locale.ROOT).startsWith(REST_PREFIX);
    }

    private static Step parseEndurance(RawBlock block, List<LineToken> head, List<LineToken> tail)
            throws OwfParseException {
        ScannedLine line = block.getLine();
        List<String> name = new ArrayList<>();
        name.add(head.get(0).getText());
        Duration duration = null;
        Distance distance = null;
        boolean inMetrics = false;
        for (LineToken token : head.subList(1, head.size())) {
            Duration asDuration = Duration.tryParse(token.getText());
            Distance asDistance = asDuration == null ? Distance.tryParse(token.getText()) : null;
            if (asDuration != null) {
                if (duration != null) {
                    throw error(line, token, "Duplicate duration '" + token.getText() + "'");
                }
                duration = asDuration;
                inMetrics = true;
            } else if (asDistance != null) {
                if (distance != null) {
                    throw error(line, token, "Duplicate distance '" + token.getText() + "'");
                }
                distance = asDistance;
                inMetrics = true;
            } else if (inMetrics) {
                throw error(line, token, "Unexpected '" + token.getText() + "' after step metrics");
            } else {
                name.add(token.getText());
            }
        }
        return new EnduranceStep(
                line.getLocation(),
                String.join(" ", name),
                duration,
                distance,
                parameters(line, tail, false),
                block.getNotes());
    }

    private static Step parseStrength(RawBlock block, List<LineToken> head, List<LineToken> tail)
            throws OwfParseException {
        ScannedLine line = block.getLine();
        List<String> name = new ArrayList<>();
        name.add(head.get(0).getText());
        Integer sets = null;
        Reps reps = null;
        Duration duration = null;
        LineToken metric = null;
        for (LineToken token : head.subList(1, head.size())) {
            String text = token.getText();
            Matcher setsReps = Grammar.SETS_REPS.matcher(text);
            Duration asDuration = null;
            boolean isSetsReps = setsReps.matches();
            if (!isSetsReps) {
                if (Grammar.SETS_PREFIX.matcher(text).matches()) {
                    throw error(line, token, "Invalid sets x reps '" + text + "'");
                }
                asDuration = Duration.tryParse(text);
            }
            if (!isSetsReps && asDuration == null) {
                if (metric != null) {
                    throw error(line, token, "Unexpected '" + text + "' after step metrics");
                }
                name.add(text);
                continue;
            }
            if (metric != null) {
                throw error(
                        line,
                        token,
                        "Only one of sets x reps or duration is allowed, found '"
                                + metric.getText()
                                + "' and '"
                                + text
                                + "'");
            }
            metric = token;
            if (asDuration != null) {
                duration = asDuration;
                continue;
            }
            if (setsReps.group(1) != null) {
                sets = Numbers.toInt(setsReps.group(1), line.locationAt(token.getColumn()), "Sets");
                if (sets == 0) {
                    throw error(line, token, "Invalid sets x reps '" + text + "': sets must be positive");
                }
            }
            String repsText = setsReps.group(2);
            if (repsText.equalsIgnoreCase("max")) {
                reps = Reps.max();
            } else {
                int count = Numbers.toInt(repsText, line.locationAt(token.getColumn()), "Reps");
                if (count == 0) {
                    throw error(line, token, "Invalid sets x reps '" + text + "': reps must be positive");
                }
                reps = Reps.of(count);
            }
        }

        Duration rest = null;
        List<LineToken> parameterTokens = tail;
        if (!tail.isEmpty()) {
            LineToken last = tail.get(tail.size() - 1);
            if (last.getText().toLowerCase(Locale.ROOT).startsWith(REST_PREFIX)) {
                String value = last.getText().substring(REST_PREFIX.length());
                rest = Duration.tryParse(value);
                if (rest == null) {
                    throw error(line, last, "Invalid rest duration '" + value + "'");
                }
                parameterTokens = tail.subList(0, tail.size() - 1);
            }
        }
        return new StrengthStep(
                line.getLocation(),
                String.join(" ", name),
                sets,
                reps,
                duration,
                rest,
                parameters(line, parameterTokens, true),
                block.getNotes());
    }

    private static List<Parameter> parameters(ScannedLine line, List<LineToken> tail, boolean strength)
            throws OwfParseException {
        for (LineToken token : tail) {
            if (token.getText().toLowerCase(Locale.ROOT).startsWith(REST_PREFIX)) {
                throw error(
                        line,
                        token,
                        strength
                                ? "rest: must be the last token of a step"
                                : "rest: is only allowed on strength steps");
            }
        }
        return ParameterParser.parse(line, tail);
    }

    private static Step parseContainer(RawBlock block, String content, SourceLocation location)
            throws OwfParseException {
        ScannedLine line = block.getLine();
        String header = content.strip();
        Matcher matcher;
        Step container;
        if ((matcher = EMOM_ALTERNATING.matcher(header)).matches()) {
            container =
                    new AlternatingEmomStep(
                            location, duration(line, matcher.group(1)), children(block), block.getNotes());
        } else if ((matcher = EMOM.matcher(header)).matches()) {
            container = new EmomStep(location, duration(line, matcher.group(1)), children(block), block.getNotes());
        } else if ((matcher = EVERY.matcher(header)).matches()) {
            container =
                    new CustomIntervalStep(
                            location,
                            duration(line, matcher.group(1)),
                            duration(line, matcher.group(2)),
                            children(block),
                            block.getNotes());
        } else if ((matcher = AMRAP.matcher(header)).matches()) {
            container = new AmrapStep(location, duration(line, matcher.group(1)), children(block), block.getNotes());
        } else if ((matcher = FOR_TIME.matcher(header)).matches()) {
            Duration cap = matcher.group(1) == null ? null : duration(line, matcher.group(1));
            container = new ForTimeStep(location, cap, children(block), block.getNotes());
        } else if ((matcher = SUPERSET.matcher(header)).matches()) {
            container = new SupersetStep(location, count(line, matcher.group(1)), children(block), block.getNotes());
        } else if ((matcher = CIRCUIT.matcher(header)).matches()) {
            container = new CircuitStep(location, count(line, matcher.group(1)), children(block), block.getNotes());
        } else if ((matcher = REPEAT.matcher(header)).matches()) {
            container = new RepeatStep(location, count(line, matcher.group(1)), children(block), block.getNotes());
        } else {
            throw new OwfParseException(location, "Unknown container keyword '" + header + "'");
        }
        return container;
    }

    private static List<Step> children(RawBlock block) throws OwfParseException {
        if (block.getChildren().isEmpty()) {
            throw new OwfParseException(
                    block.getLine().getLocation(),
                    "Container '" + block.getLine().getContent() + "' has no steps");
        }
        return parseAll(block.getChildren());
    }

    private static Duration duration(ScannedLine line, String text) throws OwfParseException {
        Duration duration = Duration.tryParse(text, true);
        if (duration == null) {
            throw new OwfParseException(line.getLocation(), "Invalid duration '" + text + "'");
        }
        if (duration.isZero()) {
            throw new OwfParseException(line.getLocation(), "Duration must be positive: '" + text + "'");
        }
        return duration;
    }

    private static int count(ScannedLine line, String text) throws OwfParseException {
        int count = Numbers.toInt(text, line.getLocation(), "Count");
        if (count <= 0) {
            throw new OwfParseException(line.getLocation(), "Count must be positive: " + count);
        }
        return count;
    }

    private static void rejectChildren(RawBlock block) throws OwfParseException {
        if (!block.getChildren().isEmpty()) {
            RawBlock child = block.getChildren().get(0);
            throw new OwfParseException(
                    child.getLine().getLocation(),
                    "Only container steps (ending with ':') can have nested steps");
        }
    }

    private static OwfParseException error(ScannedLine line, LineToken token, String reason) {
        return new OwfParseException(line.locationAt(token.getColumn()), reason);
    }
}
