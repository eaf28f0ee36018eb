package dev.classifiermetrics.metric;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * F1 averaged over classes, each class weighted by its support (the number of examples that
 * actually belong to it).
 *
 * <p>Every example is judged against every class, so all per-class accumulators share the same
 * total example count.
 */
public final class WeightedF1Metric implements Metric<WeightedF1Metric> {
    private final @Nonnull Map<String, ClassificationF1Metric> perClass;

    public WeightedF1Metric(@Nonnull Map<String, ClassificationF1Metric> perClass) {
        this.perClass = Collections.unmodifiableMap(new LinkedHashMap<>(perClass));
    }

    public static WeightedF1Metric empty() {
        return new WeightedF1Metric(Map.of());
    }

    /** Per-class f1 accumulators, in the order classes were first seen. */
    public @Nonnull Map<String, ClassificationF1Metric> perClass() {
        return perClass;
    }

    @Override
    public boolean macroAverage() {
        return true;
    }

    @Override
    public @Nonnull WeightedF1Metric merge(@Nullable WeightedF1Metric other) {
        if (other == null) {
            return this;
        }
        var merged = new LinkedHashMap<>(perClass);
        other.perClass.forEach(
                (label, f1) -> merged.merge(label, f1, ClassificationF1Metric::merge));
        return new WeightedF1Metric(merged);
    }

    @Override
    public double value() {
        if (perClass.isEmpty()) {
            return 0.0;
        }
        double totalExamples = perClass.values().iterator().next().counts().total();
        if (totalExamples == 0) {
            return 0.0;
        }
        double weightedF1 = 0.0;
        for (var f1 : perClass.values()) {
            weightedF1 += f1.value() * (f1.counts().actualPositives() / totalExamples);
        }
        return weightedF1;
    }

    /**
     * Zips per-class f1 sequences into one weighted f1 per example. The i-th metric of every class
     * must describe the same example.
     */
    public static List<WeightedF1Metric> computeMany(
            @Nonnull Map<String, List<ClassificationF1Metric>> perClassF1s) {
        if (perClassF1s.isEmpty()) {
            return List.of();
        }
        int examples = -1;
        for (var entry : perClassF1s.entrySet()) {
            int size = entry.getValue().size();
            if (examples == -1) {
                examples = size;
            } else if (size != examples) {
                throw new IllegalArgumentException(
                        "class %s has %d f1 metrics, expected %d"
                                .formatted(entry.getKey(), size, examples));
            }
        }
        var result = new ArrayList<WeightedF1Metric>(examples);
        for (int i = 0; i < examples; i++) {
            var example = new LinkedHashMap<String, ClassificationF1Metric>();
            for (var entry : perClassF1s.entrySet()) {
                example.put(entry.getKey(), entry.getValue().get(i));
            }
            result.add(new WeightedF1Metric(example));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof WeightedF1Metric that && perClass.equals(that.perClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(perClass);
    }

    @Override
    public String toString() {
        return "WeightedF1Metric" + perClass;
    }
}
