package com.openworkout.owf.ast;

import java.util.Objects;

public final class PowerParameter extends Parameter {
    private final Expression value;

    public PowerParameter(SourceLocation location, Expression value) {
        super(location);
        this.value = Objects.requireNonNull(value, "value");
    }

    public Expression getValue() {
        return value;
    }

    public PowerParameter withValue(Expression newValue) {
        return new PowerParameter(getLocation(), newValue);
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitPower(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PowerParameter && value.equals(((PowerParameter) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash("power", value);
    }

    @Override
    public String toString() {
        return "@" + value;
    }
}
