package io.github.cyfko.propql.core.model;

import io.github.cyfko.propql.core.config.ReservedSymbol;

import java.util.Set;

/**
 * Conjunction of two or more distinct operands.
 *
 * @param operands the conjoined expressions
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record And(Set<Expression> operands) implements Junction {

    public And {
        operands = JunctionOperands.check(operands, "And");
    }

    @Override
    public char symbol() {
        return ReservedSymbol.AND;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
