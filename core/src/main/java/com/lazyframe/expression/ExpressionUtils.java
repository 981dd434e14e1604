package com.lazyframe.expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Utility methods for inspecting and rewriting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns the names of all columns referenced by the expression, in
     * first-occurrence order.
     *
     * @param expr the expression to inspect
     * @return the referenced column names
     */
    public static Set<String> referencedColumns(Expression expr) {
        Set<String> names = new LinkedHashSet<>();
        collectColumns(expr, names);
        return names;
    }

    /**
     * Returns the union of the columns referenced by several expressions.
     *
     * @param exprs the expressions to inspect
     * @return the referenced column names
     */
    public static Set<String> referencedColumns(List<? extends Expression> exprs) {
        Set<String> names = new LinkedHashSet<>();
        for (Expression expr : exprs) {
            collectColumns(expr, names);
        }
        return names;
    }

    private static void collectColumns(Expression expr, Set<String> names) {
        if (expr instanceof ColumnReference) {
            names.add(((ColumnReference) expr).columnName());
            return;
        }
        if (expr instanceof UnresolvedColumn) {
            names.add(((UnresolvedColumn) expr).columnName());
            return;
        }
        for (Expression child : expr.children()) {
            collectColumns(child, names);
        }
    }

    /**
     * Splits a predicate into its top-level AND conjuncts.
     *
     * @param predicate the predicate
     * @return the conjuncts, left to right
     */
    public static List<Expression> splitConjuncts(Expression predicate) {
        List<Expression> conjuncts = new ArrayList<>();
        splitInto(predicate, conjuncts);
        return conjuncts;
    }

    private static void splitInto(Expression predicate, List<Expression> out) {
        if (predicate instanceof BinaryExpression
                && ((BinaryExpression) predicate).operator() == BinaryExpression.Operator.AND) {
            BinaryExpression and = (BinaryExpression) predicate;
            splitInto(and.left(), out);
            splitInto(and.right(), out);
        } else {
            out.add(predicate);
        }
    }

    /**
     * Combines conjuncts into a left-deep AND chain.
     *
     * @param conjuncts the conjuncts (must not be empty)
     * @return the combined predicate
     */
    public static Expression combineConjuncts(List<Expression> conjuncts) {
        if (conjuncts.isEmpty()) {
            throw new IllegalArgumentException("conjuncts must not be empty");
        }
        Expression result = conjuncts.get(0);
        for (int i = 1; i < conjuncts.size(); i++) {
            result = BinaryExpression.and(result, conjuncts.get(i));
        }
        return result;
    }

    /**
     * Rewrites an expression bottom-up. The function sees each node after its
     * children have been rewritten; unchanged subtrees are kept as-is.
     *
     * @param expr the expression
     * @param rule the rewrite applied to each node
     * @return the rewritten expression
     */
    public static Expression transform(Expression expr, Function<Expression, Expression> rule) {
        List<Expression> children = expr.children();
        Expression current = expr;
        if (!children.isEmpty()) {
            List<Expression> newChildren = new ArrayList<>(children.size());
            boolean changed = false;
            for (Expression child : children) {
                Expression rewritten = transform(child, rule);
                changed |= rewritten != child;
                newChildren.add(rewritten);
            }
            if (changed) {
                current = expr.withNewChildren(newChildren);
            }
        }
        return rule.apply(current);
    }

    /**
     * Replaces column references by name.
     *
     * @param expr the expression
     * @param replacements column name to replacement expression
     * @return the expression with substitutions applied
     */
    public static Expression substitute(Expression expr, Map<String, Expression> replacements) {
        return transform(expr, e -> {
            if (e instanceof ColumnReference) {
                Expression replacement = replacements.get(((ColumnReference) e).columnName());
                return replacement != null ? replacement : e;
            }
            return e;
        });
    }

    /**
     * Removes a top-level alias.
     *
     * @param expr the expression
     * @return the aliased expression, or {@code expr} itself
     */
    public static Expression stripAlias(Expression expr) {
        return expr instanceof AliasExpression ? ((AliasExpression) expr).expression() : expr;
    }

    /**
     * Returns the output column name an expression produces in a projection.
     *
     * @param expr the expression
     * @return the alias, the column name, or the SQL text
     */
    public static String outputName(Expression expr) {
        if (expr instanceof AliasExpression) {
            return ((AliasExpression) expr).alias();
        }
        if (expr instanceof ColumnReference) {
            return ((ColumnReference) expr).columnName();
        }
        if (expr instanceof UnresolvedColumn) {
            return ((UnresolvedColumn) expr).columnName();
        }
        return expr.toSQL();
    }
}
