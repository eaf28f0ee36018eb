package dev.classifiermetrics.report;

import dev.classifiermetrics.metric.Metric;
import dev.classifiermetrics.metric.MetricMergeException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Accumulates named metrics. Recording under an existing name merges into the running accumulator,
 * so concurrent evaluation steps may record into the same registry.
 */
@Slf4j
public final class MetricsRegistry {
    private final ConcurrentHashMap<String, Metric<?>> metrics = new ConcurrentHashMap<>();

    public <M extends Metric<M>> void record(@Nonnull String name, @Nullable M metric) {
        Objects.requireNonNull(name);
        if (metric == null) {
            return;
        }
        metrics.merge(name, metric, (existing, added) -> mergeUnchecked(name, existing, added));
    }

    /** Records a batch of per-example metrics under one name. */
    public <M extends Metric<M>> void recordAll(
            @Nonnull String name, @Nonnull Collection<M> batch) {
        M combined = null;
        for (M metric : batch) {
            combined = Metric.merge(combined, metric);
        }
        record(name, combined);
    }

    public Optional<Metric<?>> get(@Nonnull String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    public <M extends Metric<M>> Optional<M> get(@Nonnull String name, @Nonnull Class<M> type) {
        return get(name).filter(type::isInstance).map(type::cast);
    }

    public SortedSet<String> names() {
        return new TreeSet<>(metrics.keySet());
    }

    public int size() {
        return metrics.size();
    }

    public void clear() {
        metrics.clear();
    }

    /** Current value of every metric, sorted by name. */
    public Map<String, Double> report() {
        var report = new LinkedHashMap<String, Double>();
        for (var name : names()) {
            report.put(name, metrics.get(name).value());
        }
        return report;
    }

    /** A new registry holding this registry's metrics merged with {@code other}'s. */
    public MetricsRegistry merge(@Nullable MetricsRegistry other) {
        var merged = new MetricsRegistry();
        merged.metrics.putAll(metrics);
        if (other != null) {
            other.metrics.forEach(
                    (name, metric) ->
                            merged.metrics.merge(
                                    name,
                                    metric,
                                    (existing, added) -> mergeUnchecked(name, existing, added)));
        }
        return merged;
    }

    /**
     * Reports metrics gathered by independent shards. Macro-averaged metrics report the unweighted
     * mean of the shards that recorded them; the others are merged and valued once.
     */
    public static Map<String, Double> aggregate(@Nonnull Collection<MetricsRegistry> shards) {
        var byName = new TreeMap<String, List<Metric<?>>>();
        for (var shard : shards) {
            shard.metrics.forEach(
                    (name, metric) ->
                            byName.computeIfAbsent(name, k -> new ArrayList<>()).add(metric));
        }
        var report = new LinkedHashMap<String, Double>();
        byName.forEach(
                (name, perShard) -> {
                    for (int i = 1; i < perShard.size(); i++) {
                        requireSameType(name, perShard.get(0), perShard.get(i));
                    }
                    if (perShard.get(0).macroAverage()) {
                        report.put(
                                name,
                                perShard.stream().mapToDouble(Metric::value).average().orElse(0));
                    } else {
                        Metric<?> merged = perShard.get(0);
                        for (int i = 1; i < perShard.size(); i++) {
                            merged = mergeUnchecked(name, merged, perShard.get(i));
                        }
                        report.put(name, merged.value());
                    }
                });
        log.debug("aggregated {} metrics over {} shards", report.size(), shards.size());
        return report;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Metric<?> mergeUnchecked(String name, Metric<?> left, Metric<?> right) {
        requireSameType(name, left, right);
        return ((Metric) left).merge(right);
    }

    private static void requireSameType(String name, Metric<?> left, Metric<?> right) {
        if (left.getClass() != right.getClass()) {
            throw new MetricMergeException(
                    "metric %s recorded as both %s and %s"
                            .formatted(
                                    name,
                                    left.getClass().getSimpleName(),
                                    right.getClass().getSimpleName()));
        }
    }
}
