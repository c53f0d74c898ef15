package com.openworkout.owf.ast;

import java.util.List;
import java.util.Objects;

/** {@code Nx circuit:} cycles through its stations for N rounds. */
public final class CircuitStep extends ContainerStep {
    private final int count;

    public CircuitStep(SourceLocation location, int count, List<Step> children, List<String> notes) {
        super(location, children, notes);
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive: " + count);
        }
        this.count = count;
    }

    public int getCount() {
        return count;
    }

    @Override
    public CircuitStep withChildren(List<Step> newChildren) {
        return new CircuitStep(getLocation(), count, newChildren, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitCircuit(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CircuitStep)) {
            return false;
        }
        CircuitStep other = (CircuitStep) obj;
        return count == other.count && sameChildrenAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, getChildren(), getNotes());
    }
}
