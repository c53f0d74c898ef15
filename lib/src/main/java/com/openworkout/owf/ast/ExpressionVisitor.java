package com.openworkout.owf.ast;

public interface ExpressionVisitor<R> {
    R visitLiteral(LiteralExpression literal);

    R visitVariable(VariableReference variable);

    R visitPercentage(PercentageOf percentage);

    R visitBinary(BinaryOperation operation);
}
