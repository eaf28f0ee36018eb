package dev.classifiermetrics.metric;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.DoubleStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Area under the ROC curve for one positive class, computed exactly over a grid of decision
 * thresholds.
 *
 * <p>For every threshold {@code t} of the grid the metric stores how many negative samples (false
 * positives) and positive samples (true positives) had a predicted probability {@code >= t}. The
 * grid holds both grid-aligned neighbours of every observed probability plus {@link
 * #SENTINEL_THRESHOLD}, which no sample can reach. Counts are therefore piecewise constant between
 * grid points, which is what lets accumulators built over different grids be merged exactly.
 */
public final class AucMetric implements Metric<AucMetric> {
    /** Threshold above any probability, where nothing is predicted positive. */
    public static final double SENTINEL_THRESHOLD = 1.5;

    public static final int DEFAULT_DECIMAL_PLACES = 3;

    /** Finest supported grid; beyond it grid indices lose precision as doubles. */
    public static final int MAX_DECIMAL_PLACES = 9;

    private final @Nonnull String classLabel;
    private final double[] thresholds;
    private final long[] falsePositives;
    private final long[] truePositives;
    private final long positiveCount;
    private final long negativeCount;

    /** Cumulative counts of samples at or above one threshold. */
    public record Bucket(long falsePositives, long truePositives) {
        public static final Bucket ZERO = new Bucket(0, 0);

        Bucket plus(Bucket other) {
            return new Bucket(
                    falsePositives + other.falsePositives, truePositives + other.truePositives);
        }
    }

    private AucMetric(
            String classLabel,
            double[] thresholds,
            long[] falsePositives,
            long[] truePositives,
            long positiveCount,
            long negativeCount) {
        this.classLabel = classLabel;
        this.thresholds = thresholds;
        this.falsePositives = falsePositives;
        this.truePositives = truePositives;
        this.positiveCount = positiveCount;
        this.negativeCount = negativeCount;
    }

    /** An accumulator with no samples; the identity of {@link #merge}. */
    public static AucMetric empty(@Nonnull String classLabel) {
        return new AucMetric(
                Objects.requireNonNull(classLabel), new double[0], new long[0], new long[0], 0, 0);
    }

    /** Rebuilds a metric from stored state, checking every invariant of the grid. */
    public static AucMetric of(
            @Nonnull String classLabel,
            @Nonnull double[] thresholds,
            @Nonnull long[] falsePositives,
            @Nonnull long[] truePositives,
            long positiveCount,
            long negativeCount) {
        Objects.requireNonNull(classLabel);
        if (thresholds.length != falsePositives.length
                || thresholds.length != truePositives.length) {
            throw new IllegalArgumentException(
                    "thresholds and counts differ in length: %d, %d, %d"
                            .formatted(
                                    thresholds.length,
                                    falsePositives.length,
                                    truePositives.length));
        }
        if (positiveCount < 0 || negativeCount < 0) {
            throw new IllegalArgumentException("class counts must be non-negative");
        }
        for (int i = 0; i < thresholds.length; i++) {
            if (!Double.isFinite(thresholds[i])) {
                throw new IllegalArgumentException("threshold is not finite: " + thresholds[i]);
            }
            if (falsePositives[i] < 0
                    || truePositives[i] < 0
                    || falsePositives[i] > negativeCount
                    || truePositives[i] > positiveCount) {
                throw new IllegalArgumentException(
                        "bucket at threshold %s is out of range".formatted(thresholds[i]));
            }
            if (i > 0) {
                if (Double.compare(thresholds[i - 1], thresholds[i]) >= 0) {
                    throw new IllegalArgumentException(
                            "thresholds must be strictly ascending at index " + i);
                }
                if (falsePositives[i] > falsePositives[i - 1]
                        || truePositives[i] > truePositives[i - 1]) {
                    throw new IllegalArgumentException(
                            "counts must not increase with the threshold at index " + i);
                }
            }
        }
        return new AucMetric(
                classLabel,
                thresholds.clone(),
                falsePositives.clone(),
                truePositives.clone(),
                positiveCount,
                negativeCount);
    }

    public static AucMetric rawDataToAuc(
            @Nonnull List<String> trueLabels,
            @Nonnull double[] probabilities,
            @Nonnull String classLabel) {
        return rawDataToAuc(trueLabels, probabilities, classLabel, DEFAULT_DECIMAL_PLACES);
    }

    /**
     * Builds the accumulator for one batch of samples.
     *
     * @param trueLabels gold label of every sample
     * @param probabilities predicted probability of {@code classLabel} for every sample, in [0, 1]
     * @param classLabel the class treated as positive
     * @param decimalPlaces precision of the threshold grid
     */
    public static AucMetric rawDataToAuc(
            @Nonnull List<String> trueLabels,
            @Nonnull double[] probabilities,
            @Nonnull String classLabel,
            int decimalPlaces) {
        Objects.requireNonNull(classLabel);
        if (trueLabels.size() != probabilities.length) {
            throw new IllegalArgumentException(
                    "labels and probabilities differ in length: %d != %d"
                            .formatted(trueLabels.size(), probabilities.length));
        }
        if (decimalPlaces < 0 || decimalPlaces > MAX_DECIMAL_PLACES) {
            throw new IllegalArgumentException(
                    "decimal places must be within [0, %d]: %d"
                            .formatted(MAX_DECIMAL_PLACES, decimalPlaces));
        }
        if (probabilities.length == 0) {
            return empty(classLabel);
        }
        var probs = new double[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            double p = probabilities[i];
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new IllegalArgumentException(
                        "probability at index %d is outside [0, 1]: %s".formatted(i, p));
            }
            // -0.0 sorts below 0.0 and would become a threshold of its own
            probs[i] = p == 0.0 ? 0.0 : p;
        }

        long positives = trueLabels.stream().filter(classLabel::equals).count();
        long negatives = trueLabels.size() - positives;

        double scale = Math.pow(10, decimalPlaces);
        double[] grid =
                DoubleStream.concat(
                                DoubleStream.of(SENTINEL_THRESHOLD),
                                Arrays.stream(probs)
                                        .flatMap(
                                                p -> {
                                                    long k = gridIndexAtOrBelow(p, scale);
                                                    double below = k / scale;
                                                    return below == p
                                                            ? DoubleStream.of(below)
                                                            : DoubleStream.of(
                                                                    below, (k + 1) / scale);
                                                }))
                        .sorted()
                        .distinct()
                        .toArray();

        // tally each sample at the highest threshold it clears, then accumulate downwards
        var falsePositives = new long[grid.length];
        var truePositives = new long[grid.length];
        for (int i = 0; i < probs.length; i++) {
            int highest = highestIndexAtOrBelow(grid, probs[i]);
            if (classLabel.equals(trueLabels.get(i))) {
                truePositives[highest]++;
            } else {
                falsePositives[highest]++;
            }
        }
        for (int i = grid.length - 2; i >= 0; i--) {
            falsePositives[i] += falsePositives[i + 1];
            truePositives[i] += truePositives[i + 1];
        }
        return new AucMetric(classLabel, grid, falsePositives, truePositives, positives, negatives);
    }

    public @Nonnull String classLabel() {
        return classLabel;
    }

    public double[] thresholds() {
        return thresholds.clone();
    }

    public long[] falsePositiveCounts() {
        return falsePositives.clone();
    }

    public long[] truePositiveCounts() {
        return truePositives.clone();
    }

    public long positiveCount() {
        return positiveCount;
    }

    public long negativeCount() {
        return negativeCount;
    }

    /** Number of thresholds in the grid. */
    public int size() {
        return thresholds.length;
    }

    /**
     * Counts of samples with probability {@code >= threshold}. A threshold missing from the grid
     * resolves to the smallest grid threshold above it, or to the last one when there is none.
     */
    public @Nonnull Bucket bucket(double threshold) {
        if (thresholds.length == 0) {
            return Bucket.ZERO;
        }
        int index = Arrays.binarySearch(thresholds, threshold);
        if (index < 0) {
            index = Math.min(-index - 1, thresholds.length - 1);
        }
        return new Bucket(falsePositives[index], truePositives[index]);
    }

    @Override
    public boolean macroAverage() {
        return false;
    }

    @Override
    public @Nonnull AucMetric merge(@Nullable AucMetric other) {
        if (other == null) {
            return this;
        }
        if (!classLabel.equals(other.classLabel)) {
            throw new MetricMergeException(
                    "cannot merge AUC for class %s with AUC for class %s"
                            .formatted(classLabel, other.classLabel));
        }
        double[] merged = mergeSortedDistinct(thresholds, other.thresholds);
        var mergedFalsePositives = new long[merged.length];
        var mergedTruePositives = new long[merged.length];
        for (int i = 0; i < merged.length; i++) {
            var bucket = bucket(merged[i]).plus(other.bucket(merged[i]));
            mergedFalsePositives[i] = bucket.falsePositives();
            mergedTruePositives[i] = bucket.truePositives();
        }
        return new AucMetric(
                classLabel,
                merged,
                mergedFalsePositives,
                mergedTruePositives,
                positiveCount + other.positiveCount,
                negativeCount + other.negativeCount);
    }

    /**
     * Area under the ROC curve.
     *
     * <p>Walking the grid in ascending order traces the curve from (1, 1) down to (0, 0). The
     * trapezoidal area between that curve and the true-positive-rate axis is the complement of the
     * area under it.
     *
     * @throws ArithmeticException when no positive or no negative sample was seen
     */
    @Override
    public double value() {
        if (positiveCount == 0 || negativeCount == 0) {
            throw new ArithmeticException(
                    "AUC for class %s is undefined with %d positive and %d negative samples"
                            .formatted(classLabel, positiveCount, negativeCount));
        }
        double area = 0.0;
        for (int i = 0; i + 1 < thresholds.length; i++) {
            double fprLow = (double) falsePositives[i] / negativeCount;
            double fprHigh = (double) falsePositives[i + 1] / negativeCount;
            double tprLow = (double) truePositives[i] / positiveCount;
            double tprHigh = (double) truePositives[i + 1] / positiveCount;
            area += (tprLow - tprHigh) * (fprLow + fprHigh) / 2;
        }
        return 1 - area;
    }

    /**
     * Largest {@code k} with {@code k / scale <= p}. {@code Math.floor(p * scale)} alone can be off
     * by one when the product rounds across an integer, e.g. just below 0.117 at three places.
     */
    static long gridIndexAtOrBelow(double p, double scale) {
        long k = (long) Math.floor(p * scale);
        while (k > 0 && k / scale > p) {
            k--;
        }
        while ((k + 1) / scale <= p) {
            k++;
        }
        return k;
    }

    private static int highestIndexAtOrBelow(double[] sorted, double value) {
        int index = Arrays.binarySearch(sorted, value);
        return index >= 0 ? index : -index - 2;
    }

    static double[] mergeSortedDistinct(double[] left, double[] right) {
        var out = new double[left.length + right.length];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < left.length && j < right.length) {
            int cmp = Double.compare(left[i], right[j]);
            if (cmp < 0) {
                out[n++] = left[i++];
            } else if (cmp > 0) {
                out[n++] = right[j++];
            } else {
                out[n++] = left[i++];
                j++;
            }
        }
        while (i < left.length) {
            out[n++] = left[i++];
        }
        while (j < right.length) {
            out[n++] = right[j++];
        }
        return Arrays.copyOf(out, n);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AucMetric that)) {
            return false;
        }
        return positiveCount == that.positiveCount
                && negativeCount == that.negativeCount
                && classLabel.equals(that.classLabel)
                && Arrays.equals(thresholds, that.thresholds)
                && Arrays.equals(falsePositives, that.falsePositives)
                && Arrays.equals(truePositives, that.truePositives);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(classLabel, positiveCount, negativeCount);
        result = 31 * result + Arrays.hashCode(thresholds);
        result = 31 * result + Arrays.hashCode(falsePositives);
        result = 31 * result + Arrays.hashCode(truePositives);
        return result;
    }

    @Override
    public String toString() {
        return "AucMetric{class=%s, thresholds=%d, positives=%d, negatives=%d}"
                .formatted(classLabel, thresholds.length, positiveCount, negativeCount);
    }
}
