package io.github.cyfko.propql.core.model;

import java.util.Objects;

/**
 * Negation of a single operand.
 *
 * @param operand the negated expression
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Not(Expression operand) implements Expression {

    public Not {
        Objects.requireNonNull(operand, "Negated operand is required");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
