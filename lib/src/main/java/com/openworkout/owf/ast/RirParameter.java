package com.openworkout.owf.ast;

import java.util.Objects;

/** Reps in reserve. */
public final class RirParameter extends Parameter {
    private final int value;

    public RirParameter(SourceLocation location, int value) {
        super(location);
        if (value < 0) {
            throw new IllegalArgumentException("RIR must not be negative: " + value);
        }
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitRir(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof RirParameter && value == ((RirParameter) obj).value;
    }

    @Override
    public int hashCode() {
        return Objects.hash("rir", value);
    }

    @Override
    public String toString() {
        return "@RIR " + value;
    }
}
