package com.openworkout.owf.ast;

import java.util.List;
import java.util.Objects;

/**
 * One line of a workout (plus, for containers, the lines nested under it). Each step owns its
 * parameters and notes; equality compares content and ignores the source location.
 */
public sealed abstract class Step
        permits EnduranceStep, StrengthStep, RestStep, IncludeStep, ContainerStep {

    private final SourceLocation location;
    private final List<Parameter> parameters;
    private final List<String> notes;

    protected Step(SourceLocation location, List<Parameter> parameters, List<String> notes) {
        this.location = location;
        this.parameters = List.copyOf(parameters);
        this.notes = List.copyOf(notes);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<String> getNotes() {
        return notes;
    }

    public abstract <R> R accept(StepVisitor<R> visitor);

    protected final boolean sameParametersAndNotes(Step other) {
        return parameters.equals(other.parameters) && notes.equals(other.notes);
    }

    protected final int parametersAndNotesHash() {
        return Objects.hash(parameters, notes);
    }
}
