package com.openworkout.owf.ast;

/** An {@code @}-prefixed modifier attached to a step. */
public sealed abstract class Parameter
        permits PaceParameter,
                PowerParameter,
                WeightParameter,
                HeartRateParameter,
                RpeParameter,
                RirParameter,
                IntensityParameter {

    private final SourceLocation location;

    protected Parameter(SourceLocation location) {
        this.location = location;
    }

    /** Location of the {@code @} sign. */
    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R> R accept(ParameterVisitor<R> visitor);
}
