package com.openworkout.owf.ast;

import com.openworkout.owf.units.Pace;
import java.util.Objects;

public final class PaceParameter extends Parameter {
    private final Pace pace;

    public PaceParameter(SourceLocation location, Pace pace) {
        super(location);
        this.pace = Objects.requireNonNull(pace, "pace");
    }

    public Pace getPace() {
        return pace;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitPace(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PaceParameter && pace.equals(((PaceParameter) obj).pace);
    }

    @Override
    public int hashCode() {
        return pace.hashCode();
    }

    @Override
    public String toString() {
        return "@" + pace;
    }
}
