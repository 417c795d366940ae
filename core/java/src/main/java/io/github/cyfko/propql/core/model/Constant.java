package io.github.cyfko.propql.core.model;

/**
 * Boolean literal.
 *
 * @param value the literal value
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Constant(boolean value) implements Expression {

    public static final Constant TRUE = new Constant(true);
    public static final Constant FALSE = new Constant(false);

    /**
     * @param value the literal value
     * @return the shared instance for {@code value}
     */
    public static Constant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * @return the constant with the opposite value
     */
    public Constant negate() {
        return of(!value);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
