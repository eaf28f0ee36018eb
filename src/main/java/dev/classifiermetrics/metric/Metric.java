package dev.classifiermetrics.metric;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An immutable accumulator of evaluation results that can be computed independently over disjoint
 * shards of data and combined afterwards.
 *
 * <p>{@link #merge(Metric)} must be associative and commutative, and merging with {@code null}
 * returns the receiver unchanged.
 *
 * @param <M> the concrete metric type produced by a merge
 */
public interface Metric<M extends Metric<M>> {

    /** Scalar value of everything accumulated so far. */
    double value();

    /**
     * Whether this metric should be macro-averaged when globally reported. When {@code true} the
     * global value is the unweighted mean of per-shard values, otherwise shards are merged first
     * and valued once.
     */
    boolean macroAverage();

    /** Combines this metric with another one. Never mutates either operand. */
    @Nonnull
    M merge(@Nullable M other);

    /** Merges two metrics where either side may be absent. */
    static <M extends Metric<M>> @Nullable M merge(@Nullable M left, @Nullable M right) {
        if (left == null) {
            return right;
        }
        return left.merge(right);
    }
}
