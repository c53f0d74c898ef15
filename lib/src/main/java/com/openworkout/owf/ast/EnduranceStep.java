package com.openworkout.owf.ast;

import com.openworkout.owf.units.Distance;
import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Objects;

/** Cardio effort such as {@code run 5km @easy} or {@code bike 20min @200W}. */
public final class EnduranceStep extends Step {
    private final String action;
    private final Duration duration;
    private final Distance distance;

    public EnduranceStep(
            SourceLocation location,
            String action,
            Duration duration,
            Distance distance,
            List<Parameter> parameters,
            List<String> notes) {
        super(location, parameters, notes);
        this.action = Objects.requireNonNull(action, "action");
        this.duration = duration;
        this.distance = distance;
    }

    public String getAction() {
        return action;
    }

    public Duration getDuration() {
        return duration;
    }

    public Distance getDistance() {
        return distance;
    }

    public EnduranceStep withParameters(List<Parameter> newParameters) {
        return new EnduranceStep(getLocation(), action, duration, distance, newParameters, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitEndurance(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EnduranceStep)) {
            return false;
        }
        EnduranceStep other = (EnduranceStep) obj;
        return action.equals(other.action)
                && Objects.equals(duration, other.duration)
                && Objects.equals(distance, other.distance)
                && sameParametersAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, duration, distance, parametersAndNotesHash());
    }
}
