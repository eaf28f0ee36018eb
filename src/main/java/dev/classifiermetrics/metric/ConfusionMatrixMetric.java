package dev.classifiermetrics.metric;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Keeps count of the confusion matrix of a binary decision. Concrete variants differ only in how
 * they turn the counts into a value; every variant merges by summing the counts.
 *
 * @param <M> the concrete variant, preserved by {@link #merge}
 */
public abstract class ConfusionMatrixMetric<M extends ConfusionMatrixMetric<M>>
        implements Metric<M> {

    /** The closed set of variants. Merging two different variants is a programming error. */
    public enum Kind {
        PRECISION,
        RECALL,
        F1
    }

    private final @Nonnull ConfusionCounts counts;

    protected ConfusionMatrixMetric(@Nonnull ConfusionCounts counts) {
        this.counts = Objects.requireNonNull(counts);
    }

    public abstract @Nonnull Kind kind();

    /** Builds an instance of the same variant around {@code counts}. */
    protected abstract @Nonnull M withCounts(@Nonnull ConfusionCounts counts);

    public @Nonnull ConfusionCounts counts() {
        return counts;
    }

    public double truePositives() {
        return counts.truePositives();
    }

    public double trueNegatives() {
        return counts.trueNegatives();
    }

    public double falsePositives() {
        return counts.falsePositives();
    }

    public double falseNegatives() {
        return counts.falseNegatives();
    }

    @Override
    public boolean macroAverage() {
        return true;
    }

    @Override
    public @Nonnull M merge(@Nullable M other) {
        if (other == null) {
            return withCounts(counts);
        }
        if (other.kind() != kind()) {
            throw new MetricMergeException(
                    "cannot merge %s metric with %s metric".formatted(kind(), other.kind()));
        }
        return withCounts(counts.plus(other.counts()));
    }

    /** Builds precision, recall and f1 views sharing one set of counts. */
    public static Triple computeMany(
            double truePositives,
            double trueNegatives,
            double falsePositives,
            double falseNegatives) {
        return computeMany(
                new ConfusionCounts(truePositives, trueNegatives, falsePositives, falseNegatives));
    }

    public static Triple computeMany(@Nonnull ConfusionCounts counts) {
        return new Triple(
                new PrecisionMetric(counts),
                new RecallMetric(counts),
                new ClassificationF1Metric(counts));
    }

    /**
     * Computes one metric triple per (prediction, gold label) pair, treating {@code positiveClass}
     * as the positive class and every other label as negative.
     */
    public static ClassificationMetrics computeMetrics(
            @Nonnull List<String> predictions,
            @Nonnull List<String> goldLabels,
            @Nonnull String positiveClass) {
        if (predictions.size() != goldLabels.size()) {
            throw new IllegalArgumentException(
                    "predictions and gold labels differ in length: %d != %d"
                            .formatted(predictions.size(), goldLabels.size()));
        }
        Objects.requireNonNull(positiveClass);
        var precisions = new ArrayList<PrecisionMetric>(predictions.size());
        var recalls = new ArrayList<RecallMetric>(predictions.size());
        var f1s = new ArrayList<ClassificationF1Metric>(predictions.size());
        for (int i = 0; i < predictions.size(); i++) {
            var triple =
                    computeMany(
                            ConfusionCounts.ofPair(
                                    predictions.get(i), goldLabels.get(i), positiveClass));
            precisions.add(triple.precision());
            recalls.add(triple.recall());
            f1s.add(triple.f1());
        }
        return new ClassificationMetrics(precisions, recalls, f1s);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfusionMatrixMetric<?> that)) {
            return false;
        }
        return kind() == that.kind() && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), counts);
    }

    @Override
    public String toString() {
        return "%s{tp=%s, tn=%s, fp=%s, fn=%s}"
                .formatted(
                        kind(),
                        counts.truePositives(),
                        counts.trueNegatives(),
                        counts.falsePositives(),
                        counts.falseNegatives());
    }

    /** Precision, recall and f1 built from the same counts. */
    public record Triple(
            @Nonnull PrecisionMetric precision,
            @Nonnull RecallMetric recall,
            @Nonnull ClassificationF1Metric f1) {}
}
