package com.lazyframe.expression;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.exception.TypeMismatchException;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DateType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ExpressionResolver Tests")
public class ExpressionResolverTest extends TestBase {

    private final StructType covid = schema(
        field("date", DateType.get()),
        field("state", StringType.get()),
        required("fips", IntegerType.get()),
        field("cases", LongType.get()));

    @Nested
    @DisplayName("Binding")
    class Binding {

        @Test
        @DisplayName("Unresolved columns bind to the schema's type and nullability")
        void testBind() {
            Expression resolved = ExpressionResolver.resolve(new UnresolvedColumn("fips"), covid);

            assertThat(resolved).isInstanceOf(ColumnReference.class);
            assertThat(resolved.dataType()).isEqualTo(IntegerType.get());
            assertThat(resolved.nullable()).isFalse();
        }

        @Test
        @DisplayName("Unknown column fails with the column name")
        void testUnknownColumn() {
            assertThatThrownBy(() -> ExpressionResolver.resolve(new UnresolvedColumn("county"), covid))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("county")
                .satisfies(e -> assertThat(((SchemaException) e).columnName()).isEqualTo("county"));
        }

        @Test
        @DisplayName("Arithmetic over integer and long resolves to long")
        void testArithmeticType() {
            Expression sum = ExpressionResolver.resolve(
                BinaryExpression.add(new UnresolvedColumn("fips"), new UnresolvedColumn("cases")), covid);

            assertThat(sum.dataType()).isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("Function calls resolve their return type")
        void testFunctionType() {
            Expression year = ExpressionResolver.resolve(
                new FunctionCall("YEAR", List.of(new UnresolvedColumn("date"))), covid);

            assertThat(year.dataType()).isEqualTo(IntegerType.get());
        }
    }

    @Nested
    @DisplayName("Type Checking")
    class TypeChecking {

        @Test
        @DisplayName("Comparing a string with a number fails at build time")
        void testIncompatibleComparison() {
            Expression predicate = BinaryExpression.greaterThan(new UnresolvedColumn("state"), Literal.of(10L));

            assertThatThrownBy(() -> ExpressionResolver.resolvePredicate(predicate, covid))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Comparing integer with double is allowed")
        void testNumericComparison() {
            Expression predicate = BinaryExpression.lessThan(new UnresolvedColumn("fips"), Literal.of(2.5));

            assertThat(ExpressionResolver.resolvePredicate(predicate, covid).dataType())
                .isEqualTo(BooleanType.get());
        }

        @Test
        @DisplayName("A non-boolean predicate is rejected")
        void testNonBooleanPredicate() {
            assertThatThrownBy(() -> ExpressionResolver.resolvePredicate(new UnresolvedColumn("cases"), covid))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("boolean");
        }

        @Test
        @DisplayName("Arithmetic on strings is rejected")
        void testStringArithmetic() {
            Expression expr = BinaryExpression.add(new UnresolvedColumn("state"), Literal.of(1L));

            assertThatThrownBy(() -> ExpressionResolver.resolve(expr, covid))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Cast from date to long is rejected, from string to long accepted")
        void testCastSupport() {
            assertThatThrownBy(() -> ExpressionResolver.resolve(
                CastExpression.cast(new UnresolvedColumn("date"), LongType.get()), covid))
                .isInstanceOf(TypeMismatchException.class);
            assertThat(ExpressionResolver.resolve(
                CastExpression.tryCast(new UnresolvedColumn("state"), DoubleType.get()), covid).dataType())
                .isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("Unknown function fails resolution")
        void testUnknownFunction() {
            Expression call = new FunctionCall("soundex", List.of(new UnresolvedColumn("state")));

            assertThatThrownBy(() -> ExpressionResolver.resolve(call, covid))
                .isInstanceOf(SchemaException.class);
        }
    }

    @Nested
    @DisplayName("Utilities")
    class Utilities {

        @Test
        @DisplayName("Conjuncts split and recombine")
        void testConjuncts() {
            Expression a = BinaryExpression.equal(ColumnReference.of("state", StringType.get()), Literal.of("Ohio"));
            Expression b = BinaryExpression.greaterThan(ColumnReference.of("cases", LongType.get()), Literal.of(1L));
            Expression c = UnaryExpression.isNotNull(ColumnReference.of("fips", IntegerType.get()));

            List<Expression> conjuncts = ExpressionUtils.splitConjuncts(
                BinaryExpression.and(a, BinaryExpression.and(b, c)));

            assertThat(conjuncts).containsExactly(a, b, c);
            assertThat(ExpressionUtils.splitConjuncts(ExpressionUtils.combineConjuncts(conjuncts)))
                .containsExactly(a, b, c);
        }

        @Test
        @DisplayName("Referenced columns are collected in order")
        void testReferencedColumns() {
            Expression expr = BinaryExpression.and(
                BinaryExpression.equal(ColumnReference.of("state", StringType.get()), Literal.of("Ohio")),
                BinaryExpression.greaterThan(ColumnReference.of("cases", LongType.get()), Literal.of(1L)));

            assertThat(ExpressionUtils.referencedColumns(expr)).containsExactly("state", "cases");
        }
    }
}
