package com.openworkout.owf.ast;

import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Objects;

/** {@code every 2min for 20min:} starts a round at every interval until the total time is up. */
public final class CustomIntervalStep extends ContainerStep {
    private final Duration interval;
    private final Duration duration;

    public CustomIntervalStep(
            SourceLocation location,
            Duration interval,
            Duration duration,
            List<Step> children,
            List<String> notes) {
        super(location, children, notes);
        this.interval = Objects.requireNonNull(interval, "interval");
        this.duration = Objects.requireNonNull(duration, "duration");
        if (interval.isZero() || duration.isZero()) {
            throw new IllegalArgumentException("Interval and duration must be positive");
        }
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public CustomIntervalStep withChildren(List<Step> newChildren) {
        return new CustomIntervalStep(getLocation(), interval, duration, newChildren, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitCustomInterval(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CustomIntervalStep)) {
            return false;
        }
        CustomIntervalStep other = (CustomIntervalStep) obj;
        return interval.equals(other.interval)
                && duration.equals(other.duration)
                && sameChildrenAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, duration, getChildren(), getNotes());
    }
}
