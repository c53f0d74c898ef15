package com.openworkout.owf.ast;

import java.util.Objects;

/** Heart-rate target: either an expression ({@code 140bpm}, {@code 70% of max HR}) or a zone label. */
public final class HeartRateParameter extends Parameter {
    private final Expression value;
    private final String zone;

    private HeartRateParameter(SourceLocation location, Expression value, String zone) {
        super(location);
        this.value = value;
        this.zone = zone;
    }

    public static HeartRateParameter ofExpression(SourceLocation location, Expression value) {
        return new HeartRateParameter(location, Objects.requireNonNull(value, "value"), null);
    }

    public static HeartRateParameter ofZone(SourceLocation location, String zone) {
        return new HeartRateParameter(location, null, Objects.requireNonNull(zone, "zone"));
    }

    public boolean isZone() {
        return zone != null;
    }

    /** Expression target, or {@code null} when this is a zone. */
    public Expression getValue() {
        return value;
    }

    /** Zone label such as {@code Z2}, or {@code null} when this is an expression. */
    public String getZone() {
        return zone;
    }

    public HeartRateParameter withValue(Expression newValue) {
        return ofExpression(getLocation(), newValue);
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitHeartRate(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof HeartRateParameter)) {
            return false;
        }
        HeartRateParameter other = (HeartRateParameter) obj;
        return Objects.equals(value, other.value) && Objects.equals(zone, other.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash("hr", value, zone);
    }

    @Override
    public String toString() {
        return "@" + (isZone() ? zone : value.toString());
    }
}
