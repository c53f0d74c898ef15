package com.openworkout.owf.ast;

import java.util.Objects;

public final class BinaryOperation extends Expression {

    public enum Operator {
        PLUS("+"),
        MINUS("-");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            return null;
        }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public BinaryOperation(
            SourceLocation location, Operator operator, Expression left, Expression right) {
        super(location);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BinaryOperation)) {
            return false;
        }
        BinaryOperation other = (BinaryOperation) obj;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return left + " " + operator.getSymbol() + " " + right;
    }
}
