package dev.classifiermetrics.metric;

import javax.annotation.Nonnull;

/** Recall of a classifier: TP / (TP + FN), or 0 when there are no true positives. */
public final class RecallMetric extends ConfusionMatrixMetric<RecallMetric> {

    public RecallMetric(@Nonnull ConfusionCounts counts) {
        super(counts);
    }

    public RecallMetric(
            double truePositives,
            double trueNegatives,
            double falsePositives,
            double falseNegatives) {
        this(new ConfusionCounts(truePositives, trueNegatives, falsePositives, falseNegatives));
    }

    @Override
    public @Nonnull Kind kind() {
        return Kind.RECALL;
    }

    @Override
    protected @Nonnull RecallMetric withCounts(@Nonnull ConfusionCounts counts) {
        return new RecallMetric(counts);
    }

    @Override
    public double value() {
        if (truePositives() == 0) {
            return 0.0;
        }
        return truePositives() / (truePositives() + falseNegatives());
    }
}
