package org.kidoni.calculus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.kidoni.calculus.domain.NumericDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.Character.isDigit;
import static java.lang.Character.isLetter;
import static java.lang.Character.isWhitespace;

/**
 * Infix expression parser for one numeric domain.
 * <p>
 * Grammar:
 * <pre>
 *  Expr:     Operand (Op Operand)*
 *  Op:       '+' | '-' | '*' | '/' | '^'
 *  Operand:  '-' Primary | '(' Expr ')' | Primary
 *  Primary:  Number | Number 'i' | Function '(' Expr ')' | Variable | '(' Expr ')'
 *  Number:   '[0-9]'* ('.' '[0-9]'*)?
 *  Function: 'sin' | 'cos' | 'exp' | 'ln'
 *  Variable: '[a-z]'+
 * </pre>
 * {@code ^} binds tighter than {@code * /}, which bind tighter than {@code + -}. Operators of equal
 * priority, {@code ^} included, associate left to right: {@code 2^3^2} is {@code (2^3)^2}.
 * <p>
 * A minus where an operand is expected negates the primary that follows it, so {@code -x^2} is
 * {@code (-1*x)^2}. Whitespace separates tokens and is otherwise ignored; letters are case-folded.
 * An imaginary literal such as {@code 2.5i} is accepted only by a complex domain.
 * <p>
 * Instances hold no parse state and may be shared.
 */
public class ExpressionParser<T> {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionParser.class);

    private static final char OPEN = '(';
    private static final char CLOSE = ')';
    private static final char IMAGINARY_UNIT = 'i';

    private final NumericDomain<T> domain;

    public ExpressionParser(final NumericDomain<T> domain) {
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    /**
     * @throws ParseException if {@code text} is not a well-formed expression
     */
    public Expression<T> parse(final String text) {
        Objects.requireNonNull(text, "text");
        logger.debug("parsing '{}' in the {} domain", text, domain.name());

        return parseExpr(text.toLowerCase(Locale.ROOT), 0);
    }

    /**
     * @return whether {@code text} contains an imaginary literal such as {@code 3i}
     */
    public static boolean containsImaginaryLiteral(final String text) {
        final String input = text.toLowerCase(Locale.ROOT);
        for (int pos = 0; pos + 1 < input.length(); pos++) {
            final char c = input.charAt(pos);
            if ((isDigit(c) || c == '.') && input.charAt(pos + 1) == IMAGINARY_UNIT && !isLetterAt(input, pos + 2)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses {@code text}, a substring of the original input starting at {@code offset}; the
     * offset only serves error positions.
     */
    private Expression<T> parseExpr(final String text, final int offset) {
        final Deque<Expression<T>> operands = new ArrayDeque<>();
        final Deque<Pending> operators = new ArrayDeque<>();

        int pos = skipWhitespace(text, 0);
        if (pos == text.length()) {
            throw new ParseException("empty expression", text, offset);
        }

        boolean expectOperand = true;
        while (pos < text.length()) {
            final char c = text.charAt(pos);

            if (expectOperand) {
                if (c == OPEN) {
                    operators.push(new Pending(OPEN, offset + pos));
                    pos++;
                }
                else if (c == '-') {
                    final Operand<T> operand = readPrimary(text, skipWhitespace(text, pos + 1), offset);
                    operands.push(Expression.constant(domain, domain.valueOf(-1)).multiply(operand.expression()));
                    pos = operand.end();
                    expectOperand = false;
                }
                else {
                    final Operand<T> operand = readPrimary(text, pos, offset);
                    operands.push(operand.expression());
                    pos = operand.end();
                    expectOperand = false;
                }
            }
            else if (Op.isOperator(c)) {
                final Op incoming = Op.of(c);
                while (!operators.isEmpty() && operators.peek().symbol() != OPEN
                        && Op.of(operators.peek().symbol()).priority() >= incoming.priority()) {
                    reduce(operands, operators);
                }
                operators.push(new Pending(c, offset + pos));
                pos++;
                expectOperand = true;
            }
            else if (c == CLOSE) {
                while (!operators.isEmpty() && operators.peek().symbol() != OPEN) {
                    reduce(operands, operators);
                }
                if (operators.isEmpty()) {
                    throw new ParseException("unbalanced parentheses, no matching '('", String.valueOf(CLOSE), offset + pos);
                }
                operators.pop();
                pos++;
            }
            else {
                throw new ParseException("unexpected character, operator expected", String.valueOf(c), offset + pos);
            }

            pos = skipWhitespace(text, pos);
        }

        if (expectOperand) {
            throw new ParseException("unexpected end of input, operand expected", text, offset + text.length());
        }

        while (!operators.isEmpty()) {
            final Pending top = operators.peek();
            if (top.symbol() == OPEN) {
                throw new ParseException("unbalanced parentheses, no matching ')'", String.valueOf(OPEN), top.position());
            }
            reduce(operands, operators);
        }

        return operands.pop();
    }

    private void reduce(final Deque<Expression<T>> operands, final Deque<Pending> operators) {
        final Pending pending = operators.pop();
        final Expression<T> right = operands.pop();
        final Expression<T> left = operands.pop();
        operands.push(left.combine(Op.of(pending.symbol()), right));
    }

    private Operand<T> readPrimary(final String text, final int pos, final int offset) {
        if (pos >= text.length()) {
            throw new ParseException("unexpected end of input, operand expected", text, offset + pos);
        }

        final char c = text.charAt(pos);
        if (isDigit(c) || c == '.') {
            return readNumber(text, pos, offset);
        }
        if (isLetter(c)) {
            return readIdentifier(text, pos, offset);
        }
        if (c == OPEN) {
            final int close = matchingClose(text, pos, offset);
            return new Operand<>(parseExpr(text.substring(pos + 1, close), offset + pos + 1), close + 1);
        }
        throw new ParseException("operand expected", String.valueOf(c), offset + pos);
    }

    private Operand<T> readNumber(final String text, final int start, final int offset) {
        int end = start;
        boolean seenPoint = false;
        while (end < text.length() && (isDigit(text.charAt(end)) || text.charAt(end) == '.')) {
            if (text.charAt(end) == '.') {
                if (seenPoint) {
                    throw new ParseException("malformed number, second decimal point", text.substring(start, end + 1), offset + start);
                }
                seenPoint = true;
            }
            end++;
        }

        final String literal = text.substring(start, end);
        final double value;
        try {
            value = Double.parseDouble(literal);
        }
        catch (NumberFormatException e) {
            throw new ParseException("malformed number", literal, offset + start, e);
        }

        if (end < text.length() && text.charAt(end) == IMAGINARY_UNIT && !isLetterAt(text, end + 1)) {
            if (!domain.isComplex()) {
                throw new ParseException("imaginary literal in the " + domain.name() + " domain", literal + IMAGINARY_UNIT, offset + start);
            }
            return new Operand<>(Expression.constant(domain, domain.imaginary(value)), end + 1);
        }

        return new Operand<>(Expression.constant(domain, domain.valueOf(value)), end);
    }

    private Operand<T> readIdentifier(final String text, final int start, final int offset) {
        int end = start;
        while (end < text.length() && isLetter(text.charAt(end))) {
            end++;
        }

        final String name = text.substring(start, end);
        final Optional<Func> function = Func.byName(name);
        if (function.isEmpty()) {
            return new Operand<>(Expression.variable(domain, name), end);
        }

        final int open = skipWhitespace(text, end);
        if (open >= text.length() || text.charAt(open) != OPEN) {
            throw new ParseException("function '" + name + "' must be followed by '('", name, offset + start);
        }

        final int close = matchingClose(text, open, offset);
        final String argument = text.substring(open + 1, close);
        if (argument.isBlank()) {
            throw new ParseException("empty argument to function '" + name + "'", text.substring(start, close + 1), offset + start);
        }

        final Expression<T> parsed = parseExpr(argument, offset + open + 1);
        return new Operand<>(parsed.apply(function.get()), close + 1);
    }

    private static int matchingClose(final String text, final int open, final int offset) {
        int depth = 0;
        for (int pos = open; pos < text.length(); pos++) {
            final char c = text.charAt(pos);
            if (c == OPEN) {
                depth++;
            }
            else if (c == CLOSE) {
                depth--;
                if (depth == 0) {
                    return pos;
                }
            }
        }
        throw new ParseException("unbalanced parentheses, no matching ')'", String.valueOf(OPEN), offset + open);
    }

    private static int skipWhitespace(final String text, final int from) {
        int pos = from;
        while (pos < text.length() && isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isLetterAt(final String text, final int pos) {
        return pos < text.length() && isLetter(text.charAt(pos));
    }

    private record Pending(char symbol, int position) {
    }

    private record Operand<E>(Expression<E> expression, int end) {
    }
}
