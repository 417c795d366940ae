package io.github.cyfko.propql.core.utils;

import io.github.cyfko.propql.core.model.And;
import io.github.cyfko.propql.core.model.Constant;
import io.github.cyfko.propql.core.model.Expression;
import io.github.cyfko.propql.core.model.ExpressionVisitor;
import io.github.cyfko.propql.core.model.Junction;
import io.github.cyfko.propql.core.model.Not;
import io.github.cyfko.propql.core.model.Or;
import io.github.cyfko.propql.core.model.Variable;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the distinct variable names of an expression.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableCollector implements ExpressionVisitor<Void> {

    private final SortedSet<String> names = new TreeSet<>();

    private VariableCollector() {}

    /**
     * @param expression the expression to inspect, not simplified beforehand
     * @return the variable names in alphabetical order, empty for a variable-free expression
     */
    public static SortedSet<String> variables(Expression expression) {
        Objects.requireNonNull(expression, "Expression is required");
        VariableCollector collector = new VariableCollector();
        expression.accept(collector);
        return Collections.unmodifiableSortedSet(collector.names);
    }

    @Override
    public Void visitConstant(Constant constant) {
        return null;
    }

    @Override
    public Void visitVariable(Variable variable) {
        names.add(variable.name());
        return null;
    }

    @Override
    public Void visitNot(Not not) {
        return not.operand().accept(this);
    }

    @Override
    public Void visitAnd(And and) {
        return visitOperands(and);
    }

    @Override
    public Void visitOr(Or or) {
        return visitOperands(or);
    }

    private Void visitOperands(Junction junction) {
        for (Expression operand : junction.operands()) {
            operand.accept(this);
        }
        return null;
    }
}
