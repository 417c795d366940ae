package io.github.cyfko.propql.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.github.cyfko.propql.core.model.Expression.variable;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the {@link Expression} model and its canonical factories.
 */
@DisplayName("Expression Model Tests")
class ExpressionTest {

    private static final Expression A = variable("a");
    private static final Expression B = variable("b");
    private static final Expression C = variable("c");

    @Nested
    @DisplayName("Canonical factories")
    class FactoryTests {

        @Test
        @DisplayName("and() of nothing is TRUE, or() of nothing is FALSE")
        void testEmptyJunctions() {
            assertEquals(Constant.TRUE, Expression.and(List.of()));
            assertEquals(Constant.FALSE, Expression.or(List.of()));
        }

        @Test
        @DisplayName("Singleton junctions unwrap to their operand")
        void testSingletonJunctions() {
            assertEquals(Constant.TRUE, Expression.and(Constant.TRUE));
            assertEquals(Constant.FALSE, Expression.and(Constant.FALSE));
            assertEquals(Constant.TRUE, Expression.or(Constant.TRUE));
            assertEquals(Constant.FALSE, Expression.or(Constant.FALSE));
            assertEquals(A, Expression.and(A));
        }

        @Test
        @DisplayName("Duplicate operands collapse")
        void testDuplicatesCollapse() {
            assertEquals(A, Expression.and(A, A));
            assertEquals(A, Expression.or(List.of(A, A, A)));
            assertEquals(new And(Set.of(A, B)), Expression.and(A, B, A));
        }

        @Test
        @DisplayName("Constants are kept by the factories")
        void testConstantsNotFolded() {
            Expression conjunction = Expression.and(Constant.FALSE, Constant.TRUE);
            assertEquals(new And(Set.of(Constant.FALSE, Constant.TRUE)), conjunction);

            Expression disjunction = Expression.or(Constant.FALSE, Constant.TRUE);
            assertEquals(new Or(Set.of(Constant.FALSE, Constant.TRUE)), disjunction);
        }

        @Test
        @DisplayName("not() never folds")
        void testNotKeepsDoubleNegation() {
            Expression doubleNegation = Expression.not(Expression.not(A));
            assertEquals(new Not(new Not(A)), doubleNegation);
            assertEquals(new Not(Constant.TRUE), Expression.not(Constant.TRUE));
        }

        @Test
        @DisplayName("constant() returns the shared instances")
        void testConstantFactory() {
            assertSame(Constant.TRUE, Expression.constant(true));
            assertSame(Constant.FALSE, Expression.constant(false));
            assertEquals(Constant.FALSE, Constant.TRUE.negate());
        }
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("Junction equality ignores operand order")
        void testOrderIndependentEquality() {
            Expression left = Expression.and(List.of(A, B, C));
            Expression right = Expression.and(List.of(C, A, B));

            assertEquals(left, right);
            assertEquals(left.hashCode(), right.hashCode());
            assertNotEquals(left, Expression.or(List.of(A, B, C)));
        }

        @Test
        @DisplayName("Junction records reject degenerate operand sets")
        void testDegenerateJunctionsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new And(Set.of()));
            assertThrows(IllegalArgumentException.class, () -> new And(Set.of(A)));
            assertThrows(IllegalArgumentException.class, () -> new Or(Set.of(B)));
            assertThrows(IllegalArgumentException.class, () -> new Or(null));
        }

        @Test
        @DisplayName("Operand validation names the junction and copies its input")
        void testOperandValidation() {
            IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                    () -> JunctionOperands.check(Set.of(A), "Or"));
            assertEquals("Or requires at least two distinct operands, got 1", error.getMessage());

            Set<Expression> source = new HashSet<>(Set.of(A, B));
            Set<Expression> checked = JunctionOperands.check(source, "And");
            source.add(C);
            assertEquals(Set.of(A, B), checked);
        }

        @Test
        @DisplayName("Junction exposes no static helpers")
        void testJunctionHasNoStaticMembers() {
            assertTrue(Arrays.stream(Junction.class.getDeclaredMethods())
                    .filter(method -> !method.isSynthetic())
                    .noneMatch(method -> Modifier.isStatic(method.getModifiers())));
        }

        @Test
        @DisplayName("Junction operands cannot be modified")
        void testOperandsUnmodifiable() {
            Junction junction = new And(Set.of(A, B));
            assertThrows(UnsupportedOperationException.class, () -> junction.operands().add(C));
        }

        @Test
        @DisplayName("Null operands are rejected")
        void testNullOperands() {
            assertThrows(NullPointerException.class, () -> Expression.not(null));
            assertThrows(NullPointerException.class, () -> Expression.and(A, null));
            assertThrows(NullPointerException.class, () -> Expression.or((List<Expression>) null));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "a1", "a_b", "a b", "~"})
        @DisplayName("Variable names must be non-empty and alphabetic")
        void testInvalidVariableNames(String name) {
            assertThrows(IllegalArgumentException.class, () -> variable(name));
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "abc", "XyZ", "été"})
        @DisplayName("Alphabetic variable names are accepted")
        void testValidVariableNames(String name) {
            assertEquals(name, ((Variable) variable(name)).name());
        }

        @Test
        @DisplayName("Junction symbols match the grammar")
        void testSymbols() {
            assertEquals('&', new And(Set.of(A, B)).symbol());
            assertEquals('|', new Or(Set.of(A, B)).symbol());
        }
    }

    @Nested
    @DisplayName("Visitor dispatch")
    class VisitorTests {

        @SuppressWarnings("unchecked")
        private final ExpressionVisitor<String> visitor = mock(ExpressionVisitor.class);

        @Test
        @DisplayName("Each variant dispatches to its own visit method")
        void testDispatch() {
            when(visitor.visitConstant(any())).thenReturn("constant");
            when(visitor.visitVariable(any())).thenReturn("variable");
            when(visitor.visitNot(any())).thenReturn("not");
            when(visitor.visitAnd(any())).thenReturn("and");
            when(visitor.visitOr(any())).thenReturn("or");

            assertEquals("constant", Constant.TRUE.accept(visitor));
            assertEquals("variable", A.accept(visitor));
            assertEquals("not", Expression.not(A).accept(visitor));
            assertEquals("and", Expression.and(A, B).accept(visitor));
            assertEquals("or", Expression.or(A, B).accept(visitor));

            verify(visitor).visitConstant(Constant.TRUE);
            verify(visitor).visitVariable((Variable) A);
            verify(visitor).visitAnd(new And(Set.of(A, B)));
            verify(visitor).visitOr(new Or(Set.of(A, B)));
        }

        @Test
        @DisplayName("Dispatch does not descend on its own")
        void testNoImplicitTraversal() {
            Expression.not(Expression.and(A, B)).accept(visitor);

            verify(visitor).visitNot(any());
            verifyNoMoreInteractions(visitor);
        }
    }
}
