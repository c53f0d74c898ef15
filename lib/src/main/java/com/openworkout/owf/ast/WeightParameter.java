package com.openworkout.owf.ast;

import java.util.Objects;

public final class WeightParameter extends Parameter {
    private final Expression value;

    public WeightParameter(SourceLocation location, Expression value) {
        super(location);
        this.value = Objects.requireNonNull(value, "value");
    }

    public Expression getValue() {
        return value;
    }

    public WeightParameter withValue(Expression newValue) {
        return new WeightParameter(getLocation(), newValue);
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitWeight(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof WeightParameter && value.equals(((WeightParameter) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash("weight", value);
    }

    @Override
    public String toString() {
        return "@" + value;
    }
}
