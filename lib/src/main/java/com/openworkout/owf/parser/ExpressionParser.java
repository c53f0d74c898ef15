package com.openworkout.owf.parser;

import com.openworkout.owf.ast.BinaryOperation;
import com.openworkout.owf.ast.Expression;
import com.openworkout.owf.ast.LiteralExpression;
import com.openworkout.owf.ast.PercentageOf;
import com.openworkout.owf.ast.VariableReference;
import com.openworkout.owf.units.DecimalParser;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Recursive descent over the words of one parameter:
 *
 * <pre>
 * expression = term { ("+" | "-") term }
 * term       = percentage | literal | varref
 * percentage = number "%" "of" expression
 * literal    = number [unit]      (only when followed by an operator or the end)
 * varref     = word { word }      (up to the next operator or the end)
 * </pre>
 *
 * Binary operations are flat and left-associative; a percentage takes everything after {@code of}
 * as its base. Operators need no surrounding spaces: {@code bodyweight+20kg} reads as a sum. A
 * {@code -} inside a word is only an operator when a number follows it, so hyphenated variable
 * names such as {@code back-squat 1RM} stay whole.
 */
final class ExpressionParser {
    private final ScannedLine line;
    private final List<LineToken> tokens;
    private int position;

    private ExpressionParser(ScannedLine line, List<LineToken> tokens) {
        this.line = line;
        this.tokens = tokens;
    }

    static Expression parse(ScannedLine line, List<LineToken> tokens) throws OwfParseException {
        if (tokens.isEmpty()) {
            throw new OwfParseException(line.getLocation(), "Empty expression");
        }
        ExpressionParser parser = new ExpressionParser(line, splitOperators(tokens));
        Expression expression = parser.expression();
        if (parser.position < parser.tokens.size()) {
            LineToken extra = parser.tokens.get(parser.position);
            throw new OwfParseException(
                    line.locationAt(extra.getColumn()), "Unexpected '" + extra.getText() + "'");
        }
        return expression;
    }

    private Expression expression() throws OwfParseException {
        Expression left = term();
        while (position < tokens.size() && Grammar.isOperator(peek().getText())) {
            LineToken operator = tokens.get(position++);
            if (position >= tokens.size()) {
                throw new OwfParseException(
                        line.locationAt(operator.getColumn()),
                        "Expected a value after '" + operator.getText() + "'");
            }
            Expression right = term();
            left =
                    new BinaryOperation(
                            left.getLocation(),
                            BinaryOperation.Operator.fromSymbol(operator.getText()),
                            left,
                            right);
        }
        return left;
    }

    private Expression term() throws OwfParseException {
        LineToken token = peek();
        if (Grammar.isOperator(token.getText())) {
            throw new OwfParseException(
                    line.locationAt(token.getColumn()),
                    "Unexpected operator '" + token.getText() + "'");
        }
        Matcher percent = Grammar.PERCENT.matcher(token.getText());
        if (percent.matches()
                && position + 1 < tokens.size()
                && "of".equalsIgnoreCase(tokens.get(position + 1).getText())) {
            position += 2;
            if (position >= tokens.size()) {
                throw new OwfParseException(
                        line.locationAt(token.getColumn()), "Missing value after '% of'");
            }
            Expression base = expression();
            return new PercentageOf(
                    line.locationAt(token.getColumn()), DecimalParser.parse(percent.group(1)), base);
        }
        LiteralExpression literal = literal(token);
        if (literal != null) {
            position++;
            return literal;
        }
        List<LineToken> words = new ArrayList<>();
        while (position < tokens.size() && !Grammar.isOperator(peek().getText())) {
            words.add(tokens.get(position++));
        }
        return new VariableReference(line.locationAt(token.getColumn()), LineTokenizer.join(words));
    }

    private LiteralExpression literal(LineToken token) {
        boolean lastOfTerm =
                position + 1 == tokens.size()
                        || Grammar.isOperator(tokens.get(position + 1).getText());
        if (!lastOfTerm) {
            return null;
        }
        Matcher matcher = Grammar.NUMBER_WITH_UNIT.matcher(token.getText());
        if (!matcher.matches()) {
            return null;
        }
        String unit = null;
        if (!matcher.group(2).isEmpty()) {
            unit = Grammar.canonicalUnit(matcher.group(2));
            if (unit == null) {
                return null;
            }
        }
        return new LiteralExpression(
                line.locationAt(token.getColumn()), DecimalParser.parse(matcher.group(1)), unit);
    }

    static List<LineToken> splitOperators(List<LineToken> tokens) {
        List<LineToken> split = new ArrayList<>(tokens.size());
        for (LineToken token : tokens) {
            String text = token.getText();
            if (Grammar.isOperator(text)) {
                split.add(token);
                continue;
            }
            int start = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '+' || (c == '-' && numberFollows(text, i + 1))) {
                    if (i > start) {
                        split.add(new LineToken(text.substring(start, i), token.getColumn() + start));
                    }
                    split.add(new LineToken(String.valueOf(c), token.getColumn() + i));
                    start = i + 1;
                }
            }
            if (start < text.length()) {
                split.add(new LineToken(text.substring(start), token.getColumn() + start));
            }
        }
        return split;
    }

    private static boolean numberFollows(String text, int from) {
        int end = from;
        while (end < text.length() && text.charAt(end) != '+' && text.charAt(end) != '-') {
            end++;
        }
        Matcher matcher = Grammar.NUMBER_WITH_UNIT.matcher(text.substring(from, end));
        return matcher.matches()
                && (matcher.group(2).isEmpty() || Grammar.canonicalUnit(matcher.group(2)) != null);
    }

    private LineToken peek() {
        return tokens.get(position);
    }
}
