package com.openworkout.owf.ast;

import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Objects;

/** {@code amrap 15min:} as many rounds as possible within the duration. */
public final class AmrapStep extends ContainerStep {
    private final Duration duration;

    public AmrapStep(
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
    public AmrapStep withChildren(List<Step> newChildren) {
        return new AmrapStep(getLocation(), duration, newChildren, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitAmrap(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AmrapStep)) {
            return false;
        }
        AmrapStep other = (AmrapStep) obj;
        return duration.equals(other.duration) && sameChildrenAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(duration, getChildren(), getNotes());
    }
}
