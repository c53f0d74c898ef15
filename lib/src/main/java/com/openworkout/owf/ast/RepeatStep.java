package com.openworkout.owf.ast;

import java.util.List;
import java.util.Objects;

/** {@code Nx:} repeats its children N times. */
public final class RepeatStep extends ContainerStep {
    private final int count;

    public RepeatStep(SourceLocation location, int count, List<Step> children, List<String> notes) {
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
    public RepeatStep withChildren(List<Step> newChildren) {
        return new RepeatStep(getLocation(), count, newChildren, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitRepeat(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RepeatStep)) {
            return false;
        }
        RepeatStep other = (RepeatStep) obj;
        return count == other.count && sameChildrenAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, getChildren(), getNotes());
    }
}
