package dev.classifiermetrics.classifier;

import dev.classifiermetrics.config.ClassifierConfig;
import dev.classifiermetrics.metric.AucMetric;
import dev.classifiermetrics.metric.ClassificationF1Metric;
import dev.classifiermetrics.metric.ConfusionMatrixMetric;
import dev.classifiermetrics.metric.WeightedF1Metric;
import dev.classifiermetrics.report.MetricsRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Bookkeeping of a classifier's evaluation: turns per-step probabilities into predictions and
 * records per-class precision, recall and f1, weighted f1 and, for binary classifiers, the area
 * under the ROC curve.
 *
 * <p>The reference class is always first in {@link #classes()}; probability rows passed to this
 * class must use that order.
 */
@Slf4j
public final class ClassifierMetrics {
    public static final String WEIGHTED_F1 = "weighted_f1";
    public static final String AUC = "auc";

    private final @Nonnull List<String> classes;
    private final @Nonnull Set<String> vocabulary;
    private final double threshold;
    private final boolean areaUnderCurve;
    private final int aucDecimalPlaces;
    private final @Nonnull MetricsRegistry registry = new MetricsRegistry();

    private ClassifierMetrics(Builder builder) {
        if (builder.classes.isEmpty()) {
            throw new IllegalArgumentException("must provide at least one class");
        }
        var ordered = new ArrayList<>(builder.classes);
        if (builder.refClass != null) {
            if (ordered.remove(builder.refClass)) {
                ordered.add(0, builder.refClass);
            } else {
                log.warn(
                        "reference class {} is not in the class list, using {}",
                        builder.refClass,
                        ordered.get(0));
            }
        }
        this.classes = List.copyOf(ordered);
        this.vocabulary = Set.copyOf(classes);
        if (vocabulary.size() != classes.size()) {
            throw new IllegalArgumentException("class list has duplicates: " + classes);
        }
        if (!(builder.threshold >= 0.0 && builder.threshold <= 1.0)) {
            throw new IllegalArgumentException(
                    "threshold must be within [0, 1]: " + builder.threshold);
        }
        if (builder.aucDecimalPlaces < 0
                || builder.aucDecimalPlaces > AucMetric.MAX_DECIMAL_PLACES) {
            throw new IllegalArgumentException(
                    "AUC decimal places must be within [0, %d]: %d"
                            .formatted(AucMetric.MAX_DECIMAL_PLACES, builder.aucDecimalPlaces));
        }
        this.threshold = builder.threshold;
        this.aucDecimalPlaces = builder.aucDecimalPlaces;
        if (builder.areaUnderCurve && !isBinary()) {
            log.warn("area under the curve is only computed for binary classification");
        }
        this.areaUnderCurve = builder.areaUnderCurve && isBinary();
    }

    public static ClassifierMetrics of(@Nonnull ClassifierConfig config) {
        return builder()
                .classes(config.classes())
                .refClass(config.refClass().orElse(null))
                .threshold(config.threshold())
                .areaUnderCurve(config.areaUnderCurve())
                .aucDecimalPlaces(config.aucDecimalPlaces())
                .build();
    }

    public @Nonnull List<String> classes() {
        return classes;
    }

    public @Nonnull String refClass() {
        return classes.get(0);
    }

    public boolean isBinary() {
        return classes.size() == 2;
    }

    public boolean areaUnderCurve() {
        return areaUnderCurve;
    }

    public @Nonnull MetricsRegistry registry() {
        return registry;
    }

    public Map<String, Double> report() {
        return registry.report();
    }

    public void reset() {
        registry.clear();
    }

    /**
     * Picks a class per row. Binary classifiers predict the reference class when its probability
     * exceeds the threshold; otherwise the most probable class wins, the first one on ties.
     */
    public List<String> predict(@Nonnull double[][] probabilityRows) {
        var predictions = new ArrayList<String>(probabilityRows.length);
        for (var row : probabilityRows) {
            requireRow(row);
            if (isBinary()) {
                predictions.add(row[0] > threshold ? classes.get(0) : classes.get(1));
            } else {
                int best = 0;
                for (int i = 1; i < row.length; i++) {
                    if (row[i] > row[best]) {
                        best = i;
                    }
                }
                predictions.add(classes.get(best));
            }
        }
        return predictions;
    }

    /**
     * Records {@code class_<name>_prec}, {@code class_<name>_recall} and {@code class_<name>_f1}
     * for every class, plus {@link #WEIGHTED_F1}.
     */
    public void recordConfusion(
            @Nonnull List<String> predictions, @Nonnull List<String> goldLabels) {
        requireKnown(predictions);
        requireKnown(goldLabels);
        var f1s = new LinkedHashMap<String, List<ClassificationF1Metric>>();
        for (var className : classes) {
            var metrics =
                    ConfusionMatrixMetric.computeMetrics(predictions, goldLabels, className);
            registry.recordAll(precisionName(className), metrics.precisions());
            registry.recordAll(recallName(className), metrics.recalls());
            registry.recordAll(f1Name(className), metrics.f1s());
            f1s.put(className, metrics.f1s());
        }
        registry.recordAll(WEIGHTED_F1, WeightedF1Metric.computeMany(f1s));
        log.debug("recorded confusion metrics for {} examples", predictions.size());
    }

    /** Adds one step of reference-class probabilities to {@link #AUC}. No-op unless enabled. */
    public void recordAuc(
            @Nonnull List<String> goldLabels, @Nonnull double[] refClassProbabilities) {
        if (areaUnderCurve) {
            recordAucStep(aucStep(goldLabels, refClassProbabilities));
        }
    }

    /**
     * Predicts one batch, records its metrics and returns the predictions. A batch that fails
     * validation leaves the registry untouched.
     */
    public List<String> evalStep(
            @Nonnull List<String> goldLabels, @Nonnull double[][] probabilityRows) {
        if (goldLabels.size() != probabilityRows.length) {
            throw new IllegalArgumentException(
                    "labels and probability rows differ in length: %d != %d"
                            .formatted(goldLabels.size(), probabilityRows.length));
        }
        var predictions = predict(probabilityRows);
        AucMetric step = null;
        if (areaUnderCurve) {
            var refProbabilities = new double[probabilityRows.length];
            for (int i = 0; i < probabilityRows.length; i++) {
                refProbabilities[i] = probabilityRows[i][0];
            }
            step = aucStep(goldLabels, refProbabilities);
        }
        recordConfusion(predictions, goldLabels);
        if (step != null) {
            recordAucStep(step);
        }
        return predictions;
    }

    private AucMetric aucStep(List<String> goldLabels, double[] refClassProbabilities) {
        requireKnown(goldLabels);
        return AucMetric.rawDataToAuc(
                goldLabels, refClassProbabilities, refClass(), aucDecimalPlaces);
    }

    private void recordAucStep(AucMetric step) {
        registry.record(AUC, step);
        log.debug("recorded AUC step over {} thresholds", step.size());
    }

    public static String precisionName(String className) {
        return "class_" + className + "_prec";
    }

    public static String recallName(String className) {
        return "class_" + className + "_recall";
    }

    public static String f1Name(String className) {
        return "class_" + className + "_f1";
    }

    private void requireKnown(List<String> labels) {
        for (var label : labels) {
            if (!vocabulary.contains(label)) {
                log.warn("One of your labels is not in the class list: {}", label);
                throw new UnknownLabelException(label, classes);
            }
        }
    }

    private void requireRow(double[] row) {
        if (row.length != classes.size()) {
            throw new IllegalArgumentException(
                    "expected %d probabilities per row, got %d"
                            .formatted(classes.size(), row.length));
        }
        for (double p : row) {
            if (!Double.isFinite(p)) {
                throw new IllegalArgumentException("probability is not finite: " + p);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nonnull List<String> classes = List.of();
        private @Nullable String refClass;
        private double threshold = 0.5;
        private boolean areaUnderCurve = false;
        private int aucDecimalPlaces = AucMetric.DEFAULT_DECIMAL_PLACES;

        public ClassifierMetrics build() {
            return new ClassifierMetrics(this);
        }

        public Builder classes(@Nonnull List<String> classes) {
            this.classes = List.copyOf(classes);
            return this;
        }

        public Builder classes(String... classes) {
            return classes(List.of(classes));
        }

        public Builder refClass(@Nullable String refClass) {
            this.refClass = refClass;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder areaUnderCurve(boolean areaUnderCurve) {
            this.areaUnderCurve = areaUnderCurve;
            return this;
        }

        public Builder aucDecimalPlaces(int aucDecimalPlaces) {
            this.aucDecimalPlaces = aucDecimalPlaces;
            return this;
        }
    }
}
