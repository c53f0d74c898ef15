package com.openworkout.owf.ast;

import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Resistance exercise: {@code bench press 3x8rep @80kg rest:90s}, {@code pull-up max} or a timed
 * hold such as {@code plank 60s}.
 */
public final class StrengthStep extends Step {
    private final String exercise;
    private final Integer sets;
    private final Reps reps;
    private final Duration duration;
    private final Duration rest;

    public StrengthStep(
            SourceLocation location,
            String exercise,
            Integer sets,
            Reps reps,
            Duration duration,
            Duration rest,
            List<Parameter> parameters,
            List<String> notes) {
        super(location, parameters, notes);
        this.exercise = Objects.requireNonNull(exercise, "exercise");
        if (sets != null && sets <= 0) {
            throw new IllegalArgumentException("Sets must be positive: " + sets);
        }
        if (sets != null && reps == null) {
            throw new IllegalArgumentException("Sets require reps");
        }
        if (reps != null && duration != null) {
            throw new IllegalArgumentException("Reps and duration are mutually exclusive");
        }
        this.sets = sets;
        this.reps = reps;
        this.duration = duration;
        this.rest = rest;
    }

    public String getExercise() {
        return exercise;
    }

    public Integer getSets() {
        return sets;
    }

    public Reps getReps() {
        return reps;
    }

    /** Time under work for a timed set; {@code null} for rep-based sets. */
    public Duration getDuration() {
        return duration;
    }

    public Duration getRest() {
        return rest;
    }

    public StrengthStep withParameters(List<Parameter> newParameters) {
        return new StrengthStep(
                getLocation(), exercise, sets, reps, duration, rest, newParameters, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitStrength(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StrengthStep)) {
            return false;
        }
        StrengthStep other = (StrengthStep) obj;
        return exercise.equals(other.exercise)
                && Objects.equals(sets, other.sets)
                && Objects.equals(reps, other.reps)
                && Objects.equals(duration, other.duration)
                && Objects.equals(rest, other.rest)
                && sameParametersAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exercise, sets, reps, duration, rest, parametersAndNotesHash());
    }
}
