package com.openworkout.owf.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A {@code ##} block grouping several workouts, optionally with its own session-level steps
 * (e.g. a shared warm-up).
 */
public final class Session implements DocumentEntry {
    public static final String MIXED = "mixed";

    private final Heading heading;
    private final List<Step> steps;
    private final List<Workout> workouts;
    private final List<String> notes;

    public Session(Heading heading, List<Step> steps, List<Workout> workouts, List<String> notes) {
        this.heading = Objects.requireNonNull(heading, "heading");
        this.steps = List.copyOf(steps);
        this.workouts = List.copyOf(workouts);
        this.notes = List.copyOf(notes);
    }

    @Override
    public Heading getHeading() {
        return heading;
    }

    public String getName() {
        return heading.getName();
    }

    @Override
    public List<Step> getSteps() {
        return steps;
    }

    public List<Workout> getWorkouts() {
        return workouts;
    }

    @Override
    public List<String> getNotes() {
        return notes;
    }

    /**
     * Declared modality, or {@link #MIXED} when none is declared and the child workouts declare at
     * least two distinct ones. {@code null} otherwise.
     */
    public String getModality() {
        if (heading.getModality() != null) {
            return heading.getModality();
        }
        return isModalityInferred() ? MIXED : null;
    }

    public boolean isModalityInferred() {
        if (heading.getModality() != null) {
            return false;
        }
        Set<String> declared = new LinkedHashSet<>();
        for (Workout workout : workouts) {
            if (workout.getHeading().getModality() != null) {
                declared.add(workout.getHeading().getModality());
            }
        }
        return declared.size() >= 2;
    }

    public Session withContent(List<Step> newSteps, List<Workout> newWorkouts) {
        return new Session(heading, newSteps, newWorkouts, notes);
    }

    @Override
    public <R> R accept(EntryVisitor<R> visitor) {
        return visitor.visitSession(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Session)) {
            return false;
        }
        Session other = (Session) obj;
        return heading.equals(other.heading)
                && steps.equals(other.steps)
                && workouts.equals(other.workouts)
                && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(heading, steps, workouts, notes);
    }

    @Override
    public String toString() {
        return "Session[" + heading.getName() + ", " + workouts.size() + " workouts]";
    }
}
