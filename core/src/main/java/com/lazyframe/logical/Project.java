package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logical plan node representing a projection (SELECT clause).
 *
 * <p>Each projection is a resolved expression; its output column name is
 * the alias if present, otherwise the column name or the expression text.
 *
 * <p>Examples:
 * <pre>
 *   df.select(col("state"), col("cases"))
 *   df.withColumn("cases_l", col("cases").tryCast(LongType.get()))
 * </pre>
 */
public final class Project extends LogicalPlan {

    private final List<Expression> projections;

    /**
     * Creates a project node.
     *
     * @param child the child node
     * @param projections the projection expressions
     * @throws SchemaException if two projections produce the same name
     */
    public Project(LogicalPlan child, List<Expression> projections) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.projections = List.copyOf(Objects.requireNonNull(projections, "projections must not be null"));
        Set<String> names = new HashSet<>();
        for (Expression projection : this.projections) {
            String name = ExpressionUtils.outputName(projection);
            if (!names.add(name)) {
                throw new SchemaException("Ambiguous output column '" + name + "' in projection", name);
            }
        }
    }

    /**
     * Returns the projection expressions.
     *
     * @return an unmodifiable list of projections
     */
    public List<Expression> projections() {
        return projections;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>(projections.size());
        for (Expression projection : projections) {
            fields.add(new StructField(ExpressionUtils.outputName(projection),
                projection.dataType(), projection.nullable()));
        }
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return new Project(newChildren.get(0), projections);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Project)) return false;
        Project that = (Project) obj;
        return projections.equals(that.projections) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(projections, child());
    }

    @Override
    public String toString() {
        return "Project(" + projections.stream().map(Expression::toSQL).collect(Collectors.joining(", ")) + ")";
    }
}
