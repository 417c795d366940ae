package io.github.cyfko.propql.core.parsing;

import io.github.cyfko.propql.core.model.And;
import io.github.cyfko.propql.core.model.Constant;
import io.github.cyfko.propql.core.model.Expression;
import io.github.cyfko.propql.core.model.ExpressionVisitor;
import io.github.cyfko.propql.core.model.Junction;
import io.github.cyfko.propql.core.model.Not;
import io.github.cyfko.propql.core.model.Or;
import io.github.cyfko.propql.core.model.Variable;

import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Rewrites expression trees into their canonical reduced form.
 * <p>
 * The following boolean identities are applied bottom-up, children before their parent:
 * </p>
 * <ul>
 *   <li>Double negation: ~~A → A</li>
 *   <li>Constant negation: ~1 → 0, ~0 → 1</li>
 *   <li>Annihilation: A &amp; 0 → 0, A | 1 → 1</li>
 *   <li>Identity: A &amp; 1 → A, A | 0 → A</li>
 *   <li>Associativity: (A &amp; B) &amp; C → A &amp; B &amp; C, likewise for |</li>
 *   <li>Idempotence: A &amp; A → A, A | A → A (through set semantics)</li>
 * </ul>
 * <p>
 * A single pass suffices: every child is already in canonical form when its parent is rewritten,
 * so flattening only ever has to look one level down. The result is stable, i.e.
 * {@code simplify(simplify(e)).equals(simplify(e))}, and no junction in it holds a nested junction
 * of the same kind or its identity constant.
 * </p>
 * <p>
 * No normal-form conversion is attempted: distribution, De Morgan and complement laws are out of scope.
 * </p>
 *
 * <p>This class is designed to be used statically and cannot be instantiated.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * Expression e = parser.parse("a & (b & 1) & ~~c");
 * BooleanSimplifier.simplify(e);   // (a&b&c)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class BooleanSimplifier {

    private BooleanSimplifier() {}

    /**
     * @param expression the expression to simplify
     * @return a new expression in canonical reduced form
     */
    public static Expression simplify(Expression expression) {
        Objects.requireNonNull(expression, "Expression is required");
        return expression.accept(Rewriter.INSTANCE);
    }

    private enum Rewriter implements ExpressionVisitor<Expression> {
        INSTANCE;

        @Override
        public Expression visitConstant(Constant constant) {
            return constant;
        }

        @Override
        public Expression visitVariable(Variable variable) {
            return variable;
        }

        @Override
        public Expression visitNot(Not not) {
            Expression operand = not.operand().accept(this);

            // ~~A → A
            if (operand instanceof Not inner) {
                return inner.operand();
            }

            // ~1 → 0, ~0 → 1
            if (operand instanceof Constant constant) {
                return constant.negate();
            }

            return Expression.not(operand);
        }

        @Override
        public Expression visitAnd(And and) {
            return junction(and, Constant.FALSE, Members.OF_AND, Expression::and);
        }

        @Override
        public Expression visitOr(Or or) {
            return junction(or, Constant.TRUE, Members.OF_OR, Expression::or);
        }

        /**
         * @param junction    the junction to rewrite
         * @param annihilator the constant that collapses the whole junction
         * @param members     yields the operands of nested junctions of the same kind
         * @param rebuild     the canonical factory for the junction type
         */
        private Expression junction(Junction junction,
                                    Constant annihilator,
                                    Members members,
                                    Function<Set<Expression>, Expression> rebuild) {
            Set<Expression> simplified = new HashSet<>();
            for (Expression operand : junction.operands()) {
                simplified.add(operand.accept(this));
            }

            if (simplified.contains(annihilator)) {
                return annihilator;
            }

            Set<Expression> flattened = new HashSet<>();
            for (Expression operand : simplified) {
                operand.accept(members).ifPresentOrElse(flattened::addAll, () -> flattened.add(operand));
            }

            // The identity element is the negation of the annihilator.
            flattened.remove(annihilator.negate());

            return rebuild.apply(flattened);
        }
    }

    /**
     * Operands of a junction of one kind, empty for anything else.
     */
    private enum Members implements ExpressionVisitor<Optional<Set<Expression>>> {
        OF_AND {
            @Override
            public Optional<Set<Expression>> visitAnd(And and) {
                return Optional.of(and.operands());
            }
        },
        OF_OR {
            @Override
            public Optional<Set<Expression>> visitOr(Or or) {
                return Optional.of(or.operands());
            }
        };

        @Override
        public Optional<Set<Expression>> visitConstant(Constant constant) {
            return Optional.empty();
        }

        @Override
        public Optional<Set<Expression>> visitVariable(Variable variable) {
            return Optional.empty();
        }

        @Override
        public Optional<Set<Expression>> visitNot(Not not) {
            return Optional.empty();
        }

        @Override
        public Optional<Set<Expression>> visitAnd(And and) {
            return Optional.empty();
        }

        @Override
        public Optional<Set<Expression>> visitOr(Or or) {
            return Optional.empty();
        }
    }
}
