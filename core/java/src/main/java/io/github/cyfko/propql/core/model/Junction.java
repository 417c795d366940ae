package io.github.cyfko.propql.core.model;

import java.util.Set;

/**
 * An n-ary connective over an unordered set of operands.
 * <p>
 * Operand sets are unmodifiable and always hold at least two elements; equality and hash codes
 * ignore operand order. Use {@link Expression#and(java.util.Collection)} and
 * {@link Expression#or(java.util.Collection)} to build junctions from arbitrary collections.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Junction extends Expression permits And, Or {

    Set<Expression> operands();

    /**
     * @return the connective symbol used in the textual grammar
     */
    char symbol();
}
