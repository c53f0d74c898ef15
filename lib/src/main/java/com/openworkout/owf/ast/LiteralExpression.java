package com.openworkout.owf.ast;

import com.openworkout.owf.units.DecimalParser;
import java.math.BigDecimal;
import java.util.Objects;

/** A number with an optional unit, e.g. {@code 80kg} or {@code 250W}. */
public final class LiteralExpression extends Expression {
    private final BigDecimal value;
    private final String unit;

    public LiteralExpression(SourceLocation location, BigDecimal value, String unit) {
        super(location);
        this.value = DecimalParser.normalize(Objects.requireNonNull(value, "value"));
        this.unit = unit == null || unit.isEmpty() ? null : unit;
    }

    public BigDecimal getValue() {
        return value;
    }

    /** Unit suffix, or {@code null} for a bare number. */
    public String getUnit() {
        return unit;
    }

    public boolean hasUnit() {
        return unit != null;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LiteralExpression)) {
            return false;
        }
        LiteralExpression other = (LiteralExpression) obj;
        return value.compareTo(other.value) == 0 && Objects.equals(unit, other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return DecimalParser.format(value) + (unit == null ? "" : unit);
    }
}
