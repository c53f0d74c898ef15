package com.openworkout.owf.ast;

import java.util.List;
import java.util.Objects;

/** Placeholder for another workout's steps; replaced when a document is loaded from disk. */
public final class IncludeStep extends Step {
    private final String workoutName;

    public IncludeStep(SourceLocation location, String workoutName, List<String> notes) {
        super(location, List.of(), notes);
        this.workoutName = Objects.requireNonNull(workoutName, "workoutName");
    }

    public String getWorkoutName() {
        return workoutName;
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitInclude(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof IncludeStep)) {
            return false;
        }
        IncludeStep other = (IncludeStep) obj;
        return workoutName.equals(other.workoutName) && sameParametersAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workoutName, parametersAndNotesHash());
    }
}
