package io.github.cyfko.propql.core.model;

import io.github.cyfko.propql.core.config.ReservedSymbol;

/**
 * Named propositional variable.
 * <p>
 * The name is an opaque identifier made of one or more alphabetic characters; no meaning is
 * attached to it beyond identity.
 * </p>
 *
 * @param name the variable name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Variable(String name) implements Expression {

    /**
     * @throws IllegalArgumentException if the name is null, empty or contains a non-alphabetic character
     */
    public Variable {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name is required");
        }
        for (int i = 0; i < name.length(); i++) {
            if (!ReservedSymbol.isNameCharacter(name.charAt(i))) {
                throw new IllegalArgumentException(String.format(
                        "Invalid variable name '%s': character '%c' at index %d is not alphabetic",
                        name, name.charAt(i), i
                ));
            }
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
