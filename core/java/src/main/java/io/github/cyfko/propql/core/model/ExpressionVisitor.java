package io.github.cyfko.propql.core.model;

/**
 * Exhaustive dispatch over the {@link Expression} variants.
 *
 * @param <R> the result type of the traversal
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionVisitor<R> {

    R visitConstant(Constant constant);

    R visitVariable(Variable variable);

    R visitNot(Not not);

    R visitAnd(And and);

    R visitOr(Or or);
}
