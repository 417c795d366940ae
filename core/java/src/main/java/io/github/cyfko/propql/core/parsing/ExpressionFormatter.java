package io.github.cyfko.propql.core.parsing;

import io.github.cyfko.propql.core.config.ReservedSymbol;
import io.github.cyfko.propql.core.exception.ExpressionTypeException;
import io.github.cyfko.propql.core.model.And;
import io.github.cyfko.propql.core.model.Constant;
import io.github.cyfko.propql.core.model.Expression;
import io.github.cyfko.propql.core.model.ExpressionVisitor;
import io.github.cyfko.propql.core.model.Junction;
import io.github.cyfko.propql.core.model.Not;
import io.github.cyfko.propql.core.model.Or;
import io.github.cyfko.propql.core.model.Variable;

import java.util.stream.Collectors;

/**
 * Renders expression trees back into the textual grammar accepted by the parser.
 * <ul>
 *   <li>constants: {@code 1} and {@code 0}</li>
 *   <li>variables: their name</li>
 *   <li>negation: {@code ~} followed by the operand, without extra parentheses</li>
 *   <li>junctions: operands joined by {@code &} or {@code |}, always parenthesized</li>
 * </ul>
 * <p>
 * Junction operands are rendered in lexicographic order of their text, so equal expressions
 * always format identically and the output can serve as a canonical key. Parsing the output
 * yields an expression equal to the input.
 * </p>
 *
 * <pre>{@code
 * ExpressionFormatter.format(Expression.or(variable("b"), not(and(variable("a"), variable("c")))));
 * // "(b|~(a&c))"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionFormatter {

    private ExpressionFormatter() {}

    /**
     * @param expression the expression to render
     * @return the formula text
     * @throws ExpressionTypeException if {@code expression} is not a recognized expression variant
     */
    public static String format(Expression expression) {
        if (expression == null) {
            throw new ExpressionTypeException("Unexpected expression type: null");
        }
        return expression.accept(Renderer.INSTANCE);
    }

    private enum Renderer implements ExpressionVisitor<String> {
        INSTANCE;

        @Override
        public String visitConstant(Constant constant) {
            return String.valueOf(constant.value() ? ReservedSymbol.TRUE : ReservedSymbol.FALSE);
        }

        @Override
        public String visitVariable(Variable variable) {
            return variable.name();
        }

        @Override
        public String visitNot(Not not) {
            return ReservedSymbol.NOT + not.operand().accept(this);
        }

        @Override
        public String visitAnd(And and) {
            return junction(and);
        }

        @Override
        public String visitOr(Or or) {
            return junction(or);
        }

        private String junction(Junction junction) {
            return junction.operands().stream()
                    .map(operand -> operand.accept(this))
                    .sorted()
                    .collect(Collectors.joining(
                            String.valueOf(junction.symbol()),
                            String.valueOf(ReservedSymbol.LEFT_PAREN),
                            String.valueOf(ReservedSymbol.RIGHT_PAREN)));
        }
    }
}
