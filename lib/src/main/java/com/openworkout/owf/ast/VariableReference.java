package com.openworkout.owf.ast;

import java.util.Objects;

/** A free-text variable name such as {@code FTP} or {@code bench 1RM}. */
public final class VariableReference extends Expression {
    private final String name;

    public VariableReference(SourceLocation location, String name) {
        super(location);
        this.name = Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof VariableReference && name.equals(((VariableReference) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
