package io.github.cyfko.propql.core;

import io.github.cyfko.propql.core.api.ExpressionParser;
import io.github.cyfko.propql.core.config.ParserPolicy;
import io.github.cyfko.propql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.propql.core.exception.ExpressionTypeException;
import io.github.cyfko.propql.core.impl.BasicExpressionParser;
import io.github.cyfko.propql.core.model.Constant;
import io.github.cyfko.propql.core.model.Expression;
import io.github.cyfko.propql.core.parsing.BooleanSimplifier;
import io.github.cyfko.propql.core.parsing.ExpressionFormatter;
import io.github.cyfko.propql.core.utils.ExpressionSubstitutor;
import io.github.cyfko.propql.core.utils.VariableCollector;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Entry point gathering the operations on propositional formulas.
 *
 * <h2>Text and trees</h2>
 * <pre>{@code
 * Expression e = Formulas.parse("a & (b | ~a)");
 * Formulas.format(e);                         // "((b|~a)&a)"
 * Formulas.variables(e);                      // [a, b]
 * }</pre>
 *
 * <h2>Rewriting</h2>
 * <pre>{@code
 * Formulas.simplify(Formulas.parse("a & (b & 1)"));                          // (a&b)
 * Formulas.substitute(Formulas.parse("a & b"), Map.of("b", Formulas.parse("c | d")));
 * Formulas.evaluate(Formulas.parse("a & b & c"), Formulas.assignment(Map.of("a", true)));  // (b&c)
 * }</pre>
 *
 * <p>
 * Every operation is a pure function over immutable trees and can be called from any thread.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Formulas {

    private static final Logger log = Logger.getLogger(Formulas.class.getName());

    private static final ExpressionParser DEFAULT_PARSER = new BasicExpressionParser();

    private Formulas() {}

    /**
     * Parses formula text under {@link ParserPolicy#unbounded()}.
     *
     * @throws ExpressionSyntaxException if the text does not conform to the grammar
     */
    public static Expression parse(String text) {
        return DEFAULT_PARSER.parse(text);
    }

    /**
     * Parses formula text under the given policy.
     *
     * @throws ExpressionSyntaxException if the text does not conform to the grammar or exceeds the policy limits
     */
    public static Expression parse(String text, ParserPolicy policy) {
        return new BasicExpressionParser(policy).parse(text);
    }

    /**
     * @throws ExpressionTypeException if {@code expression} is not a recognized expression variant
     * @see ExpressionFormatter
     */
    public static String format(Expression expression) {
        return ExpressionFormatter.format(expression);
    }

    /**
     * @see BooleanSimplifier
     */
    public static Expression simplify(Expression expression) {
        return BooleanSimplifier.simplify(expression);
    }

    /**
     * @see ExpressionSubstitutor
     */
    public static Expression substitute(Expression expression, Map<String, ? extends Expression> bindings) {
        return ExpressionSubstitutor.substitute(expression, bindings);
    }

    /**
     * Substitutes then simplifies.
     * <p>
     * When every variable is bound to a constant the result is {@link Constant#TRUE} or
     * {@link Constant#FALSE}; otherwise it is the canonical form of what remains.
     * </p>
     *
     * @param expression the expression to evaluate
     * @param bindings   variable name to replacement expression
     * @return the simplified expression after substitution
     */
    public static Expression evaluate(Expression expression, Map<String, ? extends Expression> bindings) {
        Expression result = BooleanSimplifier.simplify(ExpressionSubstitutor.substitute(expression, bindings));
        log.finer(() -> String.format(
                "Evaluated %s with %d binding(s) to %s",
                ExpressionFormatter.format(expression), bindings.size(), ExpressionFormatter.format(result)
        ));
        return result;
    }

    /**
     * @see VariableCollector
     */
    public static Set<String> variables(Expression expression) {
        return VariableCollector.variables(expression);
    }

    /**
     * Converts a truth assignment into constant bindings usable with {@link #evaluate(Expression, Map)}.
     *
     * @param values variable name to truth value
     * @return variable name to {@link Constant}, in the iteration order of {@code values}
     * @throws NullPointerException if the map or one of its values is null
     */
    public static Map<String, Expression> assignment(Map<String, Boolean> values) {
        Objects.requireNonNull(values, "Truth values are required");
        Map<String, Expression> bindings = new LinkedHashMap<>();
        values.forEach((name, value) -> bindings.put(
                name, Constant.of(Objects.requireNonNull(value, () -> "Truth value for '" + name + "' is null"))));
        return bindings;
    }
}
