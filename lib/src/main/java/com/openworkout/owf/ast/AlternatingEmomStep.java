package com.openworkout.owf.ast;

import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Objects;

/** {@code emom 12min alternating:} one child per minute, cycling through the children. */
public final class AlternatingEmomStep extends ContainerStep {
    private final Duration duration;

    public AlternatingEmomStep(
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
    public AlternatingEmomStep withChildren(List<Step> newChildren) {
        return new AlternatingEmomStep(getLocation(), duration, newChildren, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitAlternatingEmom(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AlternatingEmomStep)) {
            return false;
        }
        AlternatingEmomStep other = (AlternatingEmomStep) obj;
        return duration.equals(other.duration) && sameChildrenAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(duration, getChildren(), getNotes());
    }
}
