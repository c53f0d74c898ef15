package com.openworkout.owf.units;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Time per distance unit, written {@code 4:30/km}. */
public final class Pace {

    private static final Pattern PATTERN =
            Pattern.compile("(\\d+):([0-5]\\d)/(km|mi|mile|100m|500m)", Pattern.CASE_INSENSITIVE);

    private final int minutes;
    private final int seconds;
    private final String unit;

    public Pace(int minutes, int seconds, String unit) {
        if (minutes < 0 || seconds < 0 || seconds > 59) {
            throw new IllegalArgumentException("Invalid pace " + minutes + ":" + seconds);
        }
        this.minutes = minutes;
        this.seconds = seconds;
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    /**
     * Returns the parsed pace, or {@code null} when {@code text} is not a pace.
     *
     * @throws IllegalArgumentException when the pace has the right shape but its minutes do not
     *     fit an {@code int}
     */
    public static Pace tryParse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        int minutes;
        try {
            minutes = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Pace minutes out of range: " + text, ex);
        }
        return new Pace(
                minutes, Integer.parseInt(matcher.group(2)), matcher.group(3).toLowerCase(Locale.ROOT));
    }

    public int getMinutes() {
        return minutes;
    }

    public int getSeconds() {
        return seconds;
    }

    public String getUnit() {
        return unit;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Pace)) {
            return false;
        }
        Pace other = (Pace) obj;
        return minutes == other.minutes && seconds == other.seconds && unit.equals(other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minutes, seconds, unit);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%d:%02d/%s", minutes, seconds, unit);
    }
}
