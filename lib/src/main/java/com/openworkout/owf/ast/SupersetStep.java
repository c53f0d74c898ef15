package com.openworkout.owf.ast;

import java.util.List;
import java.util.Objects;

/** {@code Nx superset:} alternates its exercises back to back for N rounds. */
public final class SupersetStep extends ContainerStep {
    private final int count;

    public SupersetStep(SourceLocation location, int count, List<Step> children, List<String> notes) {
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
    public SupersetStep withChildren(List<Step> newChildren) {
        return new SupersetStep(getLocation(), count, newChildren, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitSuperset(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SupersetStep)) {
            return false;
        }
        SupersetStep other = (SupersetStep) obj;
        return count == other.count && sameChildrenAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, getChildren(), getNotes());
    }
}
