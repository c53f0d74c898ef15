package com.openworkout.owf.ast;

import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Objects;

/** {@code emom 10min:} every minute on the minute for the given total time. */
public final class EmomStep extends ContainerStep {
    private final Duration duration;

    public EmomStep(
            SourceLocation location, Duration duration, List<Step> children, List<String> notes) {
        super(location, children, notes);
        this.duration = Objects.requireNonNull(duration, "duration");
        if (duration.isZero()) {
            throw new IllegalArgumentException("Duration must be positive");
        }
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public EmomStep withChildren(List<Step> newChildren) {
        return new EmomStep(getLocation(), duration, newChildren, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitEmom(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EmomStep)) {
            return false;
        }
        EmomStep other = (EmomStep) obj;
        return duration.equals(other.duration) && sameChildrenAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(duration, getChildren(), getNotes());
    }
}
