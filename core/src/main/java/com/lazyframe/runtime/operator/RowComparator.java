package com.lazyframe.runtime.operator;

import com.lazyframe.data.Row;
import com.lazyframe.logical.Sort.NullOrdering;
import com.lazyframe.logical.Sort.SortDirection;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.runtime.CompiledExpression;
import com.lazyframe.runtime.ExpressionCompiler;
import com.lazyframe.types.StructType;
import java.util.Comparator;
import java.util.List;

/**
 * Orders rows by a list of sort orders. Null placement follows each order's
 * {@link NullOrdering} regardless of direction.
 */
public final class RowComparator implements Comparator<Row> {

    private final CompiledExpression[] keys;
    private final boolean[] descending;
    private final boolean[] nullsFirst;

    public RowComparator(List<SortOrder> orders, StructType schema) {
        int n = orders.size();
        this.keys = new CompiledExpression[n];
        this.descending = new boolean[n];
        this.nullsFirst = new boolean[n];
        for (int i = 0; i < n; i++) {
            SortOrder order = orders.get(i);
            keys[i] = ExpressionCompiler.compile(order.expression(), schema);
            descending[i] = order.direction() == SortDirection.DESCENDING;
            nullsFirst[i] = order.nullOrdering() == NullOrdering.NULLS_FIRST;
        }
    }

    @Override
    public int compare(Row left, Row right) {
        for (int i = 0; i < keys.length; i++) {
            Object a = keys[i].eval(left);
            Object b = keys[i].eval(right);
            int cmp;
            if (a == null || b == null) {
                if (a == b) {
                    continue;
                }
                cmp = (a == null) == nullsFirst[i] ? -1 : 1;
            } else {
                cmp = ExpressionCompiler.compareValues(a, b);
                if (descending[i]) {
                    cmp = -cmp;
                }
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
