package com.openworkout.owf.ast;

import com.openworkout.owf.units.Duration;
import java.util.List;
import java.util.Objects;

public final class RestStep extends Step {
    private final Duration duration;

    public RestStep(
            SourceLocation location,
            Duration duration,
            List<Parameter> parameters,
            List<String> notes) {
        super(location, parameters, notes);
        this.duration = Objects.requireNonNull(duration, "duration");
    }

    public Duration getDuration() {
        return duration;
    }

    public RestStep withParameters(List<Parameter> newParameters) {
        return new RestStep(getLocation(), duration, newParameters, getNotes());
    }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitRest(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RestStep)) {
            return false;
        }
        RestStep other = (RestStep) obj;
        return duration.equals(other.duration) && sameParametersAndNotes(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(duration, parametersAndNotesHash());
    }
}
