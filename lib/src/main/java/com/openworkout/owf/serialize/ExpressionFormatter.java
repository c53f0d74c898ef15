package com.openworkout.owf.serialize;

import com.openworkout.owf.ast.BinaryOperation;
import com.openworkout.owf.ast.Expression;
import com.openworkout.owf.ast.ExpressionVisitor;
import com.openworkout.owf.ast.LiteralExpression;
import com.openworkout.owf.ast.PercentageOf;
import com.openworkout.owf.ast.VariableReference;
import com.openworkout.owf.units.DecimalParser;

/** Writes expressions back in the token form the expression parser reads. */
public final class ExpressionFormatter implements ExpressionVisitor<String> {
    private static final ExpressionFormatter INSTANCE = new ExpressionFormatter();

    private ExpressionFormatter() {}

    public static String format(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitLiteral(LiteralExpression literal) {
        String number = DecimalParser.format(literal.getValue());
        return literal.hasUnit() ? number + literal.getUnit() : number;
    }

    @Override
    public String visitVariable(VariableReference variable) {
        return variable.getName();
    }

    @Override
    public String visitPercentage(PercentageOf percentage) {
        return DecimalParser.format(percentage.getPercentage())
                + "% of "
                + percentage.getBase().accept(this);
    }

    @Override
    public String visitBinary(BinaryOperation operation) {
        return operation.getLeft().accept(this)
                + " "
                + operation.getOperator().getSymbol()
                + " "
                + operation.getRight().accept(this);
    }
}
