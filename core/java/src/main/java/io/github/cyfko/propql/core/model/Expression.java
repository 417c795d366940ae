package io.github.cyfko.propql.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable propositional formula tree.
 * <p>
 * An expression is exactly one of five variants:
 * </p>
 * <ul>
 *   <li>{@link Constant}: the literal {@code true} or {@code false}</li>
 *   <li>{@link Variable}: an opaque, alphabetic name</li>
 *   <li>{@link Not}: the negation of one operand</li>
 *   <li>{@link And}: the conjunction of a set of operands</li>
 *   <li>{@link Or}: the disjunction of a set of operands</li>
 * </ul>
 * <p>
 * The hierarchy is sealed and every traversal goes through {@link ExpressionVisitor}, so a new
 * variant cannot be added without every traversal failing to compile until it handles it.
 * </p>
 *
 * <h2>Canonical construction</h2>
 * <p>
 * Composite nodes are built through the static factories of this interface. {@link #and(Collection)}
 * and {@link #or(Collection)} collapse duplicate operands, return the identity constant for an empty
 * collection and the operand itself for a singleton, so no caller ever sees an {@code And} or
 * {@code Or} with fewer than two operands.
 * </p>
 * <pre>{@code
 * Expression e = Expression.and(Expression.variable("a"), Expression.not(Expression.variable("b")));
 * Expression.and(List.of());                       // Constant.TRUE
 * Expression.or(Expression.variable("a"));         // Variable[name=a]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Expression permits Constant, Variable, Not, Junction {

    /**
     * Dispatches to the visitor method matching this variant.
     *
     * @param visitor the visitor to dispatch to
     * @param <R>     the visitor result type
     * @return the visitor result
     */
    <R> R accept(ExpressionVisitor<R> visitor);

    static Expression constant(boolean value) {
        return Constant.of(value);
    }

    static Expression variable(String name) {
        return new Variable(name);
    }

    /**
     * Negates an expression. No folding happens here: {@code not(not(a))} is kept as written and
     * only the simplifier removes double negations.
     *
     * @param operand the expression to negate
     * @return a new {@link Not}
     */
    static Expression not(Expression operand) {
        return new Not(operand);
    }

    /**
     * Builds the canonical conjunction of the given operands.
     *
     * @param operands operands, duplicates are collapsed
     * @return {@link Constant#TRUE} when empty, the single distinct operand, or an {@link And}
     */
    static Expression and(Collection<? extends Expression> operands) {
        Set<Expression> distinct = Set.copyOf(Objects.requireNonNull(operands, "Operands are required"));
        return switch (distinct.size()) {
            case 0 -> Constant.TRUE;
            case 1 -> distinct.iterator().next();
            default -> new And(distinct);
        };
    }

    static Expression and(Expression... operands) {
        return and(Arrays.asList(operands));
    }

    /**
     * Builds the canonical disjunction of the given operands.
     *
     * @param operands operands, duplicates are collapsed
     * @return {@link Constant#FALSE} when empty, the single distinct operand, or an {@link Or}
     */
    static Expression or(Collection<? extends Expression> operands) {
        Set<Expression> distinct = Set.copyOf(Objects.requireNonNull(operands, "Operands are required"));
        return switch (distinct.size()) {
            case 0 -> Constant.FALSE;
            case 1 -> distinct.iterator().next();
            default -> new Or(distinct);
        };
    }

    static Expression or(Expression... operands) {
        return or(Arrays.asList(operands));
    }
}
