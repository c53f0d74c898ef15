package com.openworkout.owf.ast;

/**
 * Value expression inside a parameter. Nodes form a tree; equality ignores source locations.
 */
public sealed abstract class Expression
        permits LiteralExpression, VariableReference, PercentageOf, BinaryOperation {

    private final SourceLocation location;

    protected Expression(SourceLocation location) {
        this.location = location;
    }

    /** Location of the first token, or {@code null} for nodes built outside the parser. */
    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
