package io.github.cyfko.propql.core.utils;

import io.github.cyfko.propql.core.model.And;
import io.github.cyfko.propql.core.model.Constant;
import io.github.cyfko.propql.core.model.Expression;
import io.github.cyfko.propql.core.model.ExpressionVisitor;
import io.github.cyfko.propql.core.model.Junction;
import io.github.cyfko.propql.core.model.Not;
import io.github.cyfko.propql.core.model.Or;
import io.github.cyfko.propql.core.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Replaces variables by other expressions.
 * <p>
 * Every {@link Variable} whose name is bound is replaced by its bound expression, which may be a
 * constant, another variable or any subtree; unbound variables are kept. Connectives are rebuilt
 * through the canonical factories of {@link Expression}, after the constant operands of each
 * rebuilt junction have been folded: substituting {@code 0} for {@code b} in {@code a&b} yields
 * {@code 0} directly and substituting {@code 1} yields {@code a}.
 * </p>
 * <p>
 * Nothing else is rewritten: negations are kept as they are and nested junctions are not
 * flattened. Use {@link io.github.cyfko.propql.core.parsing.BooleanSimplifier} on the result for
 * the canonical form.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionSubstitutor implements ExpressionVisitor<Expression> {

    private final Map<String, ? extends Expression> bindings;

    private ExpressionSubstitutor(Map<String, ? extends Expression> bindings) {
        this.bindings = bindings;
    }

    /**
     * @param expression the expression to rewrite
     * @param bindings   variable name to replacement expression
     * @return a new expression with the bound variables replaced
     * @throws NullPointerException if an argument or a bound expression is null
     */
    public static Expression substitute(Expression expression, Map<String, ? extends Expression> bindings) {
        Objects.requireNonNull(expression, "Expression is required");
        Objects.requireNonNull(bindings, "Bindings are required");
        bindings.forEach((name, value) ->
                Objects.requireNonNull(value, () -> "Binding for variable '" + name + "' is null"));

        return expression.accept(new ExpressionSubstitutor(bindings));
    }

    @Override
    public Expression visitConstant(Constant constant) {
        return constant;
    }

    @Override
    public Expression visitVariable(Variable variable) {
        Expression bound = bindings.get(variable.name());
        return bound != null ? bound : variable;
    }

    @Override
    public Expression visitNot(Not not) {
        return Expression.not(not.operand().accept(this));
    }

    @Override
    public Expression visitAnd(And and) {
        return rebuild(and, Constant.FALSE, Expression::and);
    }

    @Override
    public Expression visitOr(Or or) {
        return rebuild(or, Constant.TRUE, Expression::or);
    }

    private Expression rebuild(Junction junction, Constant annihilator, Function<List<Expression>, Expression> factory) {
        List<Expression> operands = new ArrayList<>(junction.operands().size());
        for (Expression operand : junction.operands()) {
            Expression substituted = operand.accept(this);
            if (substituted.equals(annihilator)) {
                return annihilator;
            }
            if (!substituted.equals(annihilator.negate())) {
                operands.add(substituted);
            }
        }
        return factory.apply(operands);
    }
}
