package dev.classifiermetrics.metric;

/**
 * Confusion matrix tallies for a single binary decision. Counters may carry fractional weights.
 *
 * @param truePositives predicted positive, actually positive
 * @param trueNegatives predicted negative, actually negative
 * @param falsePositives predicted positive, actually negative
 * @param falseNegatives predicted negative, actually positive
 */
public record ConfusionCounts(
        double truePositives, double trueNegatives, double falsePositives, double falseNegatives) {

    public static final ConfusionCounts ZERO = new ConfusionCounts(0, 0, 0, 0);

    public ConfusionCounts {
        requireCounter("truePositives", truePositives);
        requireCounter("trueNegatives", trueNegatives);
        requireCounter("falsePositives", falsePositives);
        requireCounter("falseNegatives", falseNegatives);
    }

    /** Tallies for one (prediction, gold label) pair judged against {@code positiveClass}. */
    public static ConfusionCounts ofPair(String predicted, String goldLabel, String positiveClass) {
        boolean predictedPositive = positiveClass.equals(predicted);
        boolean actualPositive = positiveClass.equals(goldLabel);
        return new ConfusionCounts(
                predictedPositive && actualPositive ? 1 : 0,
                !predictedPositive && !actualPositive ? 1 : 0,
                predictedPositive && !actualPositive ? 1 : 0,
                !predictedPositive && actualPositive ? 1 : 0);
    }

    public ConfusionCounts plus(ConfusionCounts other) {
        return new ConfusionCounts(
                truePositives + other.truePositives,
                trueNegatives + other.trueNegatives,
                falsePositives + other.falsePositives,
                falseNegatives + other.falseNegatives);
    }

    /** Number of examples that are actually positive (TP + FN). */
    public double actualPositives() {
        return truePositives + falseNegatives;
    }

    /** Number of judged examples (TP + TN + FP + FN). */
    public double total() {
        return truePositives + trueNegatives + falsePositives + falseNegatives;
    }

    private static void requireCounter(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(
                    "%s must be a finite non-negative number: %s".formatted(name, value));
        }
    }
}
