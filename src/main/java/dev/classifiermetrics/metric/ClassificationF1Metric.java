package dev.classifiermetrics.metric;

import javax.annotation.Nonnull;

/** F1 of a classifier: 2TP / (2TP + FP + FN), or 0 when there are no true positives. */
public final class ClassificationF1Metric extends ConfusionMatrixMetric<ClassificationF1Metric> {

    public ClassificationF1Metric(@Nonnull ConfusionCounts counts) {
        super(counts);
    }

    public ClassificationF1Metric(
            double truePositives,
            double trueNegatives,
            double falsePositives,
            double falseNegatives) {
        this(new ConfusionCounts(truePositives, trueNegatives, falsePositives, falseNegatives));
    }

    @Override
    public @Nonnull Kind kind() {
        return Kind.F1;
    }

    @Override
    protected @Nonnull ClassificationF1Metric withCounts(@Nonnull ConfusionCounts counts) {
        return new ClassificationF1Metric(counts);
    }

    @Override
    public double value() {
        if (truePositives() == 0) {
            return 0.0;
        }
        double numerator = 2 * truePositives();
        return numerator / (numerator + falseNegatives() + falsePositives());
    }
}
