package com.openworkout.owf.ast;

import com.openworkout.owf.units.DecimalParser;
import java.math.BigDecimal;
import java.util.Objects;

/** {@code <factor>% of <base>}. */
public final class PercentageOf extends Expression {
    private final BigDecimal percentage;
    private final Expression base;

    public PercentageOf(SourceLocation location, BigDecimal percentage, Expression base) {
        super(location);
        this.percentage = DecimalParser.normalize(Objects.requireNonNull(percentage, "percentage"));
        this.base = Objects.requireNonNull(base, "base");
    }

    public BigDecimal getPercentage() {
        return percentage;
    }

    public Expression getBase() {
        return base;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPercentage(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PercentageOf)) {
            return false;
        }
        PercentageOf other = (PercentageOf) obj;
        return percentage.compareTo(other.percentage) == 0 && base.equals(other.base);
    }

    @Override
    public int hashCode() {
        return Objects.hash(percentage, base);
    }

    @Override
    public String toString() {
        return DecimalParser.format(percentage) + "% of " + base;
    }
}
