package com.lazyframe.runtime.operator;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.expression.Expression;
import com.lazyframe.runtime.CompiledExpression;
import com.lazyframe.runtime.ExpressionCompiler;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates one expression per output column.
 */
public final class ProjectOperator implements Operator {

    private final Operator child;
    private final CompiledExpression[] projections;
    private final StructType schema;

    public ProjectOperator(Operator child, List<Expression> projections, StructType schema) {
        this.child = child;
        this.schema = schema;
        this.projections = new CompiledExpression[projections.size()];
        for (int i = 0; i < this.projections.length; i++) {
            this.projections[i] = ExpressionCompiler.compile(projections.get(i), child.schema());
        }
    }

    @Override
    public void open() {
        child.open();
    }

    @Override
    public RowBatch next() {
        RowBatch batch = child.next();
        if (batch == null) {
            return null;
        }
        List<Row> rows = new ArrayList<>(batch.size());
        for (Row row : batch) {
            Object[] values = new Object[projections.length];
            for (int i = 0; i < values.length; i++) {
                values[i] = projections[i].eval(row);
            }
            rows.add(Row.wrap(values));
        }
        return RowBatch.adopt(schema, rows);
    }

    @Override
    public void close() {
        child.close();
    }

    @Override
    public StructType schema() {
        return schema;
    }
}
