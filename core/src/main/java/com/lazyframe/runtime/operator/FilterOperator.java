package com.lazyframe.runtime.operator;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.expression.Expression;
import com.lazyframe.runtime.ExpressionCompiler;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Keeps rows whose condition evaluates to TRUE.
 */
public final class FilterOperator implements Operator {

    private final Operator child;
    private final Predicate<Row> predicate;

    public FilterOperator(Operator child, Expression condition) {
        this.child = child;
        this.predicate = ExpressionCompiler.compilePredicate(condition, child.schema());
    }

    @Override
    public void open() {
        child.open();
    }

    @Override
    public RowBatch next() {
        RowBatch batch;
        while ((batch = child.next()) != null) {
            List<Row> kept = new ArrayList<>(batch.size());
            for (Row row : batch) {
                if (predicate.test(row)) {
                    kept.add(row);
                }
            }
            if (!kept.isEmpty()) {
                return RowBatch.adopt(batch.schema(), kept);
            }
        }
        return null;
    }

    @Override
    public void close() {
        child.close();
    }

    @Override
    public StructType schema() {
        return child.schema();
    }
}
