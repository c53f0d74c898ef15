package com.openworkout.owf.ast;

import java.util.List;

/** A header line ending in {@code :} that owns the steps nested under it. */
public sealed abstract class ContainerStep extends Step
        permits RepeatStep,
                SupersetStep,
                CircuitStep,
                EmomStep,
                AlternatingEmomStep,
                CustomIntervalStep,
                AmrapStep,
                ForTimeStep {

    private final List<Step> children;

    protected ContainerStep(SourceLocation location, List<Step> children, List<String> notes) {
        super(location, List.of(), notes);
        this.children = List.copyOf(children);
        if (this.children.isEmpty()) {
            throw new IllegalArgumentException("A container needs at least one step");
        }
    }

    public List<Step> getChildren() {
        return children;
    }

    /** Copy of this container with the same header and notes but different children. */
    public abstract ContainerStep withChildren(List<Step> newChildren);

    protected final boolean sameChildrenAndNotes(ContainerStep other) {
        return children.equals(other.children) && getNotes().equals(other.getNotes());
    }
}
