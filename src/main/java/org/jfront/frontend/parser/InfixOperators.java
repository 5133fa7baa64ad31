package org.jfront.frontend.parser;

import org.jfront.frontend.lexer.Token;
import org.jfront.frontend.parser.ast.BinaryOperation;
import org.jfront.frontend.parser.ast.Expression;
import org.jfront.frontend.parser.ast.InstanceOfExpression;
import org.jfront.frontend.parser.ast.Pattern;
import org.jfront.frontend.parser.ast.Type;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary operator precedence and the folding of a flat operand/operator chain into a tree.
 */
final class InfixOperators {

    // Lowest to highest.
    private static final List<List<String>> LEVELS = List.of(
            List.of("||"),
            List.of("&&"),
            List.of("|"),
            List.of("^"),
            List.of("&"),
            List.of("==", "!="),
            List.of("<", ">", ">=", "<=", "instanceof"),
            List.of("<<", ">>", ">>>"),
            List.of("+", "-"),
            List.of("*", "/", "%"));

    private static final Map<String, Integer> PRECEDENCE = buildPrecedence();

    private InfixOperators() {
        // Utility class
    }

    /**
     * One operator of a chain. A type test carries its type or pattern in place of a right operand.
     *
     * @param token The first token of the operator.
     * @param symbol The operator, with shift operators recombined from {@code >} tokens.
     * @param type The tested type of a test without binding.
     * @param pattern The pattern of a test with binding.
     */
    record Operator(Token token, String symbol, Type type, Pattern pattern) {

        static Operator binary(Token token, String symbol) {
            return new Operator(token, symbol, null, null);
        }

        boolean isTypeTest() {
            return "instanceof".equals(symbol);
        }
    }

    static boolean isInfix(String symbol) {
        return PRECEDENCE.containsKey(symbol);
    }

    /**
     * Folds a chain {@code operands[0] operators[0] operands[1] ...} into a tree.
     * Both lists have the same structure: {@code operands.size() == operators.size() + 1}, and the
     * operand following a type test is {@code null}. Equal precedence nests to the left.
     *
     * @throws SyntaxException if a type test is followed by an operator of higher precedence.
     */
    static Expression fold(List<Expression> operands, List<Operator> operators) {
        if (operands.size() != operators.size() + 1) {
            throw new ParserUsageException("Operand and operator counts do not match");
        }
        return fold(operands, operators, 0, operators.size());
    }

    private static Expression fold(List<Expression> operands, List<Operator> operators, int from, int to) {
        if (from == to) {
            return operands.get(from);
        }
        int split = from;
        int lowest = Integer.MAX_VALUE;
        for (int i = from; i < to; i++) {
            int level = PRECEDENCE.get(operators.get(i).symbol());
            if (level <= lowest) {
                lowest = level;
                split = i;
            }
        }
        Expression left = fold(operands, operators, from, split);
        Operator operator = operators.get(split);
        if (operator.isTypeTest()) {
            if (split + 1 < to) {
                Operator next = operators.get(split + 1);
                throw new SyntaxException("Unexpected operator '" + next.symbol() + "' after type test", next.token());
            }
            return new InstanceOfExpression(left.position(), left, operator.type(), operator.pattern());
        }
        Expression right = fold(operands, operators, split + 1, to);
        return new BinaryOperation(left.position(), operator.symbol(), left, right);
    }

    private static Map<String, Integer> buildPrecedence() {
        Map<String, Integer> precedence = new HashMap<>();
        for (int level = 0; level < LEVELS.size(); level++) {
            for (String symbol : LEVELS.get(level)) {
                precedence.put(symbol, level);
            }
        }
        return Map.copyOf(precedence);
    }
}
