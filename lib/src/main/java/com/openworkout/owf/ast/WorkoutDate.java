package com.openworkout.owf.ast;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Calendar date of a workout heading with an optional time range. */
public final class WorkoutDate {
    private static final Pattern SPEC =
            Pattern.compile("(\\d{4}-\\d{2}-\\d{2})(?:\\s+(\\d{2}:\\d{2})(?:-(\\d{2}:\\d{2}))?)?");
    private static final DateTimeFormatter DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("HH:mm", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);

    private final LocalDate date;
    private final LocalTime startTime;
    private final LocalTime endTime;

    public WorkoutDate(LocalDate date, LocalTime startTime, LocalTime endTime) {
        this.date = Objects.requireNonNull(date, "date");
        if (endTime != null && startTime == null) {
            throw new IllegalArgumentException("end time requires a start time");
        }
        this.startTime = startTime;
        this.endTime = endTime;
    }

    /**
     * Parses {@code YYYY-MM-DD [HH:MM[-HH:MM]]}.
     *
     * @throws IllegalArgumentException when the text is malformed or names an impossible date/time
     */
    public static WorkoutDate parse(String text) {
        Matcher matcher = SPEC.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid date: " + text.trim());
        }
        try {
            LocalDate date = LocalDate.parse(matcher.group(1), DATE);
            LocalTime start = matcher.group(2) == null ? null : LocalTime.parse(matcher.group(2), TIME);
            LocalTime end = matcher.group(3) == null ? null : LocalTime.parse(matcher.group(3), TIME);
            return new WorkoutDate(date, start, end);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid date: " + text.trim(), ex);
        }
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof WorkoutDate)) {
            return false;
        }
        WorkoutDate other = (WorkoutDate) obj;
        return date.equals(other.date)
                && Objects.equals(startTime, other.startTime)
                && Objects.equals(endTime, other.endTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, startTime, endTime);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(DATE.format(date));
        if (startTime != null) {
            builder.append(' ').append(TIME.format(startTime));
            if (endTime != null) {
                builder.append('-').append(TIME.format(endTime));
            }
        }
        return builder.toString();
    }
}
