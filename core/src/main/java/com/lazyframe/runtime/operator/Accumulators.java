package com.lazyframe.runtime.operator;

import com.lazyframe.data.GroupKey;
import com.lazyframe.logical.Aggregate.AggregateExpression;
import com.lazyframe.runtime.ExpressionCompiler;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DoubleType;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Aggregate function state.
 *
 * <p>Every function except COUNT ignores null inputs and returns null when
 * it saw no non-null input. COUNT returns 0 in that case.
 */
final class Accumulators {

    private Accumulators() {}

    /**
     * Mutable state for one aggregate in one group.
     */
    interface Accumulator {

        void add(Object value);

        Object result();
    }

    /**
     * Creates fresh state for an aggregate expression.
     *
     * @param aggregate the aggregate
     * @return the accumulator
     */
    static Accumulator create(AggregateExpression aggregate) {
        if (aggregate.isCountStar()) {
            return new CountStar();
        }
        Accumulator base = createBase(aggregate.function(), aggregate.dataType());
        return aggregate.isDistinct() ? new Distinct(base) : base;
    }

    private static Accumulator createBase(String function, DataType resultType) {
        switch (function) {
            case "COUNT":
                return new Count();
            case "SUM":
                return resultType instanceof DoubleType ? new DoubleSum() : new LongSum();
            case "AVG":
                return new Avg();
            case "MIN":
                return new Extreme(true);
            case "MAX":
                return new Extreme(false);
            default:
                throw new IllegalArgumentException("Unknown aggregate function: " + function);
        }
    }

    static final class Count implements Accumulator {
        private long count;

        @Override
        public void add(Object value) {
            if (value != null) {
                count++;
            }
        }

        @Override
        public Object result() {
            return count;
        }
    }

    /** COUNT(*): every row counts, the argument is ignored. */
    static final class CountStar implements Accumulator {
        private long count;

        @Override
        public void add(Object value) {
            count++;
        }

        @Override
        public Object result() {
            return count;
        }
    }

    static final class LongSum implements Accumulator {
        private long sum;
        private boolean seen;

        @Override
        public void add(Object value) {
            if (value != null) {
                sum += ((Number) value).longValue();
                seen = true;
            }
        }

        @Override
        public Object result() {
            return seen ? sum : null;
        }
    }

    static final class DoubleSum implements Accumulator {
        private double sum;
        private boolean seen;

        @Override
        public void add(Object value) {
            if (value != null) {
                sum += ((Number) value).doubleValue();
                seen = true;
            }
        }

        @Override
        public Object result() {
            return seen ? sum : null;
        }
    }

    static final class Avg implements Accumulator {
        private double sum;
        private long count;

        @Override
        public void add(Object value) {
            if (value != null) {
                sum += ((Number) value).doubleValue();
                count++;
            }
        }

        @Override
        public Object result() {
            return count == 0 ? null : sum / count;
        }
    }

    static final class Extreme implements Accumulator {
        private final boolean min;
        private Object current;

        Extreme(boolean min) {
            this.min = min;
        }

        @Override
        public void add(Object value) {
            if (value == null) {
                return;
            }
            if (current == null) {
                current = value;
                return;
            }
            int cmp = ExpressionCompiler.compareValues(value, current);
            if (min ? cmp < 0 : cmp > 0) {
                current = value;
            }
        }

        @Override
        public Object result() {
            return current;
        }
    }

    /** Feeds each distinct non-null value to the wrapped accumulator once. */
    static final class Distinct implements Accumulator {
        private final Accumulator delegate;
        private final Set<Object> seen = new LinkedHashSet<>();

        Distinct(Accumulator delegate) {
            this.delegate = delegate;
        }

        @Override
        public void add(Object value) {
            if (value != null && seen.add(GroupKey.normalize(value))) {
                delegate.add(value);
            }
        }

        @Override
        public Object result() {
            return delegate.result();
        }
    }
}
