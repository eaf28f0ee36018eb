package dev.classifiermetrics.metric;

import javax.annotation.Nonnull;

/** Precision of a classifier: TP / (TP + FP), or 0 when there are no true positives. */
public final class PrecisionMetric extends ConfusionMatrixMetric<PrecisionMetric> {

    public PrecisionMetric(@Nonnull ConfusionCounts counts) {
        super(counts);
    }

    public PrecisionMetric(
            double truePositives,
            double trueNegatives,
            double falsePositives,
            double falseNegatives) {
        this(new ConfusionCounts(truePositives, trueNegatives, falsePositives, falseNegatives));
    }

    @Override
    public @Nonnull Kind kind() {
        return Kind.PRECISION;
    }

    @Override
    protected @Nonnull PrecisionMetric withCounts(@Nonnull ConfusionCounts counts) {
        return new PrecisionMetric(counts);
    }

    @Override
    public double value() {
        if (truePositives() == 0) {
            return 0.0;
        }
        return truePositives() / (truePositives() + falsePositives());
    }
}
