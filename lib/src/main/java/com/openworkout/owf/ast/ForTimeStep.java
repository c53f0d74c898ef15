package com.openworkout.owf.ast;

import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Objects;

/** {@code for-time:} or {@code for-time 20min:}; the children are done once, as fast as possible. */
public final class ForTimeStep extends ContainerStep {
    private final Duration timeCap;

    public ForTimeStep(
            SourceLocation location, Duration timeCap, List<Step> children, List<String> notes) {
        super(location, children, notes);
        if (timeCap != null && timeCap.isZero()) {
            throw new IllegalArgumentException("Time cap must be positive");
        }
        this.timeCap = timeCap;
    }

    /** Optional cap; {@code null} when the header has none. */
    public Duration getTimeCap() {
        return timeCap;
    }

    @Override
    public ForTimeStep withChildren(List<Step> newChildren) {
        return new ForTimeStep(getLocation(), timeCap, newChildren, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitForTime(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ForTimeStep)) {
            return false;
        }
        ForTimeStep other = (ForTimeStep) obj;
        return Objects.equals(timeCap, other.timeCap) && sameChildrenAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeCap, getChildren(), getNotes());
    }
}
