package dev.classifiermetrics.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.classifiermetrics.metric.ConfusionCounts;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Wire form of a metric's state. Only the fields relevant to {@code type} are populated.
 *
 * @param type one of {@code precision}, {@code recall}, {@code f1}, {@code weighted_f1}, {@code
 *     auc}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricSnapshot(
        @Nonnull String type,
        @Nullable ConfusionCounts counts,
        @Nullable Map<String, ConfusionCounts> perClass,
        @Nullable String classLabel,
        @Nullable double[] thresholds,
        @Nullable long[] falsePositives,
        @Nullable long[] truePositives,
        @Nullable Long positiveCount,
        @Nullable Long negativeCount) {

    static final String PRECISION = "precision";
    static final String RECALL = "recall";
    static final String F1 = "f1";
    static final String WEIGHTED_F1 = "weighted_f1";
    static final String AUC = "auc";

    static MetricSnapshot ofCounts(String type, ConfusionCounts counts) {
        return new MetricSnapshot(type, counts, null, null, null, null, null, null, null);
    }

    static MetricSnapshot ofPerClass(Map<String, ConfusionCounts> perClass) {
        return new MetricSnapshot(WEIGHTED_F1, null, perClass, null, null, null, null, null, null);
    }

    static MetricSnapshot ofAuc(
            String classLabel,
            double[] thresholds,
            long[] falsePositives,
            long[] truePositives,
            long positiveCount,
            long negativeCount) {
        return new MetricSnapshot(
                AUC,
                null,
                null,
                classLabel,
                thresholds,
                falsePositives,
                truePositives,
                positiveCount,
                negativeCount);
    }
}
