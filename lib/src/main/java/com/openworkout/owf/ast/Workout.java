package com.openworkout.owf.ast;

import java.util.List;
import java.util.Objects;

public final class Workout implements DocumentEntry {
    private final Heading heading;
    private final List<Step> steps;
    private final List<String> notes;

    public Workout(Heading heading, List<Step> steps, List<String> notes) {
        this.heading = Objects.requireNonNull(heading, "heading");
        this.steps = List.copyOf(steps);
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

    @Override
    public List<String> getNotes() {
        return notes;
    }

    public boolean isEmpty() {
        return heading.getName().isEmpty() && steps.isEmpty() && notes.isEmpty();
    }

    public Workout withSteps(List<Step> newSteps) {
        return new Workout(heading, newSteps, notes);
    }

    @Override
    public <R> R accept(EntryVisitor<R> visitor) {
        return visitor.visitWorkout(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Workout)) {
            return false;
        }
        Workout other = (Workout) obj;
        return heading.equals(other.heading) && steps.equals(other.steps) && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(heading, steps, notes);
    }

    @Override
    public String toString() {
        return "Workout[" + heading.getName() + "]";
    }
}
