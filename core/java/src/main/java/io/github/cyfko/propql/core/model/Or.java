package io.github.cyfko.propql.core.model;

import io.github.cyfko.propql.core.config.ReservedSymbol;

import java.util.Set;

/**
 * Disjunction of two or more distinct operands.
 *
 * @param operands the disjoined expressions
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Or(Set<Expression> operands) implements Junction {

    public Or {
        operands = JunctionOperands.check(operands, "Or");
    }

    @Override
    public char symbol() {
        return ReservedSymbol.OR;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
