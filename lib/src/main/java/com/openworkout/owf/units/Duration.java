package com.openworkout.owf.units;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A span of time stored as a number of seconds.
 *
 * <p>Accepted spellings are {@code H:MM:SS}, {@code M:SS}, the compound form {@code 1h28min2s}
 * and a single decimal with a unit ({@code 1.5min}, {@code 90sec}, {@code 2hr}). A bare number is
 * only accepted when the caller supplies a default unit, which is how container headers read
 * {@code emom 10:} as ten minutes.</p>
 */
public final class Duration implements Comparable<Duration> {

    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);
    private static final BigDecimal HOUR = BigDecimal.valueOf(3600);

    private static final Pattern CLOCK_HMS = Pattern.compile("(\\d+):([0-5]\\d):([0-5]\\d)");
    private static final Pattern CLOCK_MS = Pattern.compile("(\\d+):([0-5]\\d)");
    private static final Pattern COMPOUND =
            Pattern.compile("(?:(\\d+)h)?(?:(\\d+)min)?(?:(\\d+)s)?");
    private static final Pattern SINGLE_UNIT =
            Pattern.compile(
                    "(\\d+(?:\\.\\d+)?)(s|sec|secs|min|mins|h|hr|hrs|hour|hours)",
                    Pattern.CASE_INSENSITIVE);

    private final BigDecimal seconds;

    private Duration(BigDecimal seconds) {
        this.seconds = DecimalParser.normalize(seconds);
    }

    public static Duration ofSeconds(long seconds) {
        return ofSeconds(BigDecimal.valueOf(seconds));
    }

    public static Duration ofSeconds(BigDecimal seconds) {
        Objects.requireNonNull(seconds, "seconds");
        if (seconds.signum() < 0) {
            throw new IllegalArgumentException("Negative duration: " + seconds);
        }
        return new Duration(seconds);
    }

    public static Duration ofMinutes(long minutes) {
        return ofSeconds(BigDecimal.valueOf(minutes).multiply(SIXTY));
    }

    public static Duration parse(String text) {
        Duration duration = tryParse(text);
        if (duration == null) {
            throw new IllegalArgumentException("Cannot parse duration: " + text);
        }
        return duration;
    }

    /** Returns the parsed duration, or {@code null} when {@code text} is not a duration. */
    public static Duration tryParse(String text) {
        return tryParse(text, false);
    }

    /**
     * Same as {@link #tryParse(String)}, additionally reading a bare number as minutes when
     * {@code bareMinutes} is set.
     */
    public static Duration tryParse(String text, boolean bareMinutes) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        Matcher matcher = CLOCK_HMS.matcher(trimmed);
        if (matcher.matches()) {
            return ofSeconds(
                    new BigDecimal(matcher.group(1))
                            .multiply(HOUR)
                            .add(new BigDecimal(matcher.group(2)).multiply(SIXTY))
                            .add(new BigDecimal(matcher.group(3))));
        }
        matcher = CLOCK_MS.matcher(trimmed);
        if (matcher.matches()) {
            return ofSeconds(
                    new BigDecimal(matcher.group(1)).multiply(SIXTY).add(new BigDecimal(matcher.group(2))));
        }
        matcher = SINGLE_UNIT.matcher(trimmed);
        if (matcher.matches()) {
            BigDecimal amount = DecimalParser.parse(matcher.group(1));
            String unit = matcher.group(2).toLowerCase(Locale.ROOT);
            if (unit.startsWith("s")) {
                return ofSeconds(amount);
            }
            if (unit.startsWith("m")) {
                return ofSeconds(amount.multiply(SIXTY));
            }
            return ofSeconds(amount.multiply(HOUR));
        }
        matcher = COMPOUND.matcher(trimmed);
        if (matcher.matches()) {
            BigDecimal total = BigDecimal.ZERO;
            if (matcher.group(1) != null) {
                total = total.add(new BigDecimal(matcher.group(1)).multiply(HOUR));
            }
            if (matcher.group(2) != null) {
                total = total.add(new BigDecimal(matcher.group(2)).multiply(SIXTY));
            }
            if (matcher.group(3) != null) {
                total = total.add(new BigDecimal(matcher.group(3)));
            }
            return ofSeconds(total);
        }
        if (bareMinutes && DecimalParser.isDecimal(trimmed)) {
            return ofSeconds(DecimalParser.parse(trimmed).multiply(SIXTY));
        }
        return null;
    }

    public BigDecimal getSeconds() {
        return seconds;
    }

    public boolean isZero() {
        return seconds.signum() == 0;
    }

    @Override
    public int compareTo(Duration other) {
        return seconds.compareTo(other.seconds);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Duration)) {
            return false;
        }
        return seconds.compareTo(((Duration) obj).seconds) == 0;
    }

    @Override
    public int hashCode() {
        return seconds.hashCode();
    }

    /** Canonical compound spelling, e.g. {@code 1h28min2s}; fractional values fall back to seconds. */
    @Override
    public String toString() {
        if (seconds.signum() == 0) {
            return "0s";
        }
        if (seconds.scale() > 0) {
            return DecimalParser.format(seconds) + "s";
        }
        BigInteger[] hours = seconds.setScale(0, RoundingMode.UNNECESSARY)
                .toBigIntegerExact()
                .divideAndRemainder(BigInteger.valueOf(3600));
        BigInteger[] minutes = hours[1].divideAndRemainder(BigInteger.valueOf(60));
        StringBuilder builder = new StringBuilder();
        if (hours[0].signum() > 0) {
            builder.append(hours[0]).append('h');
        }
        if (minutes[0].signum() > 0) {
            builder.append(minutes[0]).append("min");
        }
        if (minutes[1].signum() > 0) {
            builder.append(minutes[1]).append('s');
        }
        return builder.toString();
    }
}
