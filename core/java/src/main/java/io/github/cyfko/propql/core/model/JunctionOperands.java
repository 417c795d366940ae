package io.github.cyfko.propql.core.model;

import java.util.Set;

/**
 * Operand validation shared by the {@link And} and {@link Or} constructors.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class JunctionOperands {

    private JunctionOperands() {}

    /**
     * Copies and validates junction operands.
     *
     * @param operands the operands given to a record constructor
     * @param kind     the junction name, for error messages
     * @return an unmodifiable copy of the operands
     * @throws IllegalArgumentException if fewer than two distinct operands are given
     */
    static Set<Expression> check(Set<Expression> operands, String kind) {
        if (operands == null) {
            throw new IllegalArgumentException(kind + " operands are required");
        }
        Set<Expression> copy = Set.copyOf(operands);
        if (copy.size() < 2) {
            throw new IllegalArgumentException(String.format(
                    "%s requires at least two distinct operands, got %d", kind, copy.size()
            ));
        }
        return copy;
    }
}
