package com.openworkout.owf.ast;

import com.openworkout.owf.units.DecimalParser;
import java.math.BigDecimal;
import java.util.Objects;

public final class RpeParameter extends Parameter {
    private final BigDecimal value;

    public RpeParameter(SourceLocation location, BigDecimal value) {
        super(location);
        this.value = DecimalParser.normalize(Objects.requireNonNull(value, "value"));
    }

    public BigDecimal getValue() {
        return value;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitRpe(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof RpeParameter && value.compareTo(((RpeParameter) obj).value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash("rpe", value);
    }

    @Override
    public String toString() {
        return "@RPE " + DecimalParser.format(value);
    }
}
