package com.openworkout.owf.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Keyword and unit tables shared by the step, parameter and expression parsers. */
public final class Grammar {

    /** First words that make a step an endurance step. */
    public static final Set<String> ENDURANCE_ACTIONS =
            Set.of(
                    "run", "bike", "swim", "row", "ski", "walk", "hike", "jog", "cycle", "ride",
                    "elliptical", "paddle", "kayak", "skate", "climb", "warmup", "cooldown",
                    "recover");

    public static final Set<String> INTENSITIES =
            Set.of("easy", "moderate", "hard", "max", "threshold", "tempo");

    /** Literal units, keyed by lower-case spelling, mapped to their canonical spelling. */
    public static final Map<String, String> LITERAL_UNITS = literalUnits();

    public static final Set<String> WEIGHT_UNITS = Set.of("kg", "lb", "lbs");
    public static final String POWER_UNIT = "W";
    public static final String HEART_RATE_UNIT = "bpm";
    /** Box and target heights; typed as a weight parameter, the load-like target of a step. */
    public static final String HEIGHT_UNIT = "in";

    static final Set<String> HEART_RATE_WORDS = Set.of("hr", "heart", "bpm");
    static final Set<String> POWER_WORDS = Set.of("ftp", "cp", "power", "watts");

    static final Pattern SETS_REPS =
            Pattern.compile("(?:(\\d+)x)?(\\d+|max)(?:reps?)?", Pattern.CASE_INSENSITIVE);
    static final Pattern SETS_PREFIX = Pattern.compile("\\d+x.*", Pattern.CASE_INSENSITIVE);
    static final Pattern NUMBER_WITH_UNIT = Pattern.compile("(\\d+(?:\\.\\d+)?)([A-Za-z%]*)");
    static final Pattern PERCENT = Pattern.compile("(\\d+(?:\\.\\d+)?)%");

    private Grammar() {}

    private static Map<String, String> literalUnits() {
        Map<String, String> units = new LinkedHashMap<>();
        for (String unit :
                new String[] {"W", "kg", "lb", "lbs", "bpm", "in", "cm", "m", "km", "mi", "cal",
                    "kcal", "%"}) {
            units.put(unit.toLowerCase(Locale.ROOT), unit);
        }
        return Collections.unmodifiableMap(units);
    }

    /** Canonical spelling of a literal unit, or {@code null} when {@code unit} is not one. */
    public static String canonicalUnit(String unit) {
        return LITERAL_UNITS.get(unit.toLowerCase(Locale.ROOT));
    }

    static boolean isOperator(String text) {
        return "+".equals(text) || "-".equals(text);
    }
}
