package com.openworkout.owf.ast;

import java.util.Locale;
import java.util.Objects;

/** Named effort level ({@code easy}, {@code tempo}, ...), kept lower-case. */
public final class IntensityParameter extends Parameter {
    private final String name;

    public IntensityParameter(SourceLocation location, String name) {
        super(location);
        this.name = Objects.requireNonNull(name, "name").toLowerCase(Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitIntensity(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IntensityParameter && name.equals(((IntensityParameter) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("intensity", name);
    }

    @Override
    public String toString() {
        return "@" + name;
    }
}
