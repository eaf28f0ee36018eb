package dev.classifiermetrics.metric;

import java.util.List;
import javax.annotation.Nonnull;

/**
 * Per-example precision, recall and f1 metrics for one positive class, aligned by example index.
 */
public record ClassificationMetrics(
        @Nonnull List<PrecisionMetric> precisions,
        @Nonnull List<RecallMetric> recalls,
        @Nonnull List<ClassificationF1Metric> f1s) {

    public ClassificationMetrics {
        precisions = List.copyOf(precisions);
        recalls = List.copyOf(recalls);
        f1s = List.copyOf(f1s);
    }

    public int size() {
        return f1s.size();
    }
}
