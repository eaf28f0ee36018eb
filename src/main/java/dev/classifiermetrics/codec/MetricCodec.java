package dev.classifiermetrics.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.classifiermetrics.metric.AucMetric;
import dev.classifiermetrics.metric.ClassificationF1Metric;
import dev.classifiermetrics.metric.ConfusionCounts;
import dev.classifiermetrics.metric.ConfusionMatrixMetric;
import dev.classifiermetrics.metric.Metric;
import dev.classifiermetrics.metric.MetricsException;
import dev.classifiermetrics.metric.PrecisionMetric;
import dev.classifiermetrics.metric.RecallMetric;
import dev.classifiermetrics.metric.WeightedF1Metric;
import java.util.LinkedHashMap;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Encodes metric accumulators as JSON so that shard results can be shipped to wherever they are
 * merged. Decoding re-validates every invariant of the state.
 */
public final class MetricCodec {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private MetricCodec() {}

    public static @Nonnull String toJson(@Nonnull Metric<?> metric) {
        try {
            return JSON_MAPPER.writeValueAsString(toSnapshot(metric));
        } catch (JsonProcessingException e) {
            throw new MetricsException("failed to encode " + metric, e);
        }
    }

    public static @Nonnull Metric<?> fromJson(@Nonnull String json) {
        final MetricSnapshot snapshot;
        try {
            snapshot = JSON_MAPPER.readValue(json, MetricSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new MetricsException("failed to decode metric snapshot", e);
        }
        return fromSnapshot(snapshot);
    }

    /** Decodes a snapshot that must hold a metric of {@code type}. */
    public static <M extends Metric<M>> @Nonnull M fromJson(
            @Nonnull String json, @Nonnull Class<M> type) {
        var metric = fromJson(json);
        if (!type.isInstance(metric)) {
            throw new MetricsException(
                    "expected %s but snapshot holds %s"
                            .formatted(type.getSimpleName(), metric.getClass().getSimpleName()));
        }
        return type.cast(metric);
    }

    static MetricSnapshot toSnapshot(Metric<?> metric) {
        Objects.requireNonNull(metric);
        if (metric instanceof ConfusionMatrixMetric<?> confusion) {
            var type =
                    switch (confusion.kind()) {
                        case PRECISION -> MetricSnapshot.PRECISION;
                        case RECALL -> MetricSnapshot.RECALL;
                        case F1 -> MetricSnapshot.F1;
                    };
            return MetricSnapshot.ofCounts(type, confusion.counts());
        } else if (metric instanceof WeightedF1Metric weighted) {
            var perClass = new LinkedHashMap<String, ConfusionCounts>();
            weighted.perClass().forEach((label, f1) -> perClass.put(label, f1.counts()));
            return MetricSnapshot.ofPerClass(perClass);
        } else if (metric instanceof AucMetric auc) {
            return MetricSnapshot.ofAuc(
                    auc.classLabel(),
                    auc.thresholds(),
                    auc.falsePositiveCounts(),
                    auc.truePositiveCounts(),
                    auc.positiveCount(),
                    auc.negativeCount());
        }
        throw new MetricsException("no snapshot format for " + metric.getClass().getName());
    }

    static Metric<?> fromSnapshot(MetricSnapshot snapshot) {
        switch (require(snapshot.type(), "type")) {
            case MetricSnapshot.PRECISION:
                return new PrecisionMetric(require(snapshot.counts(), "counts"));
            case MetricSnapshot.RECALL:
                return new RecallMetric(require(snapshot.counts(), "counts"));
            case MetricSnapshot.F1:
                return new ClassificationF1Metric(require(snapshot.counts(), "counts"));
            case MetricSnapshot.WEIGHTED_F1:
                {
                    var perClass = new LinkedHashMap<String, ClassificationF1Metric>();
                    require(snapshot.perClass(), "perClass")
                            .forEach(
                                    (label, counts) ->
                                            perClass.put(
                                                    label, new ClassificationF1Metric(counts)));
                    return new WeightedF1Metric(perClass);
                }
            case MetricSnapshot.AUC:
                return AucMetric.of(
                        require(snapshot.classLabel(), "classLabel"),
                        require(snapshot.thresholds(), "thresholds"),
                        require(snapshot.falsePositives(), "falsePositives"),
                        require(snapshot.truePositives(), "truePositives"),
                        require(snapshot.positiveCount(), "positiveCount"),
                        require(snapshot.negativeCount(), "negativeCount"));
            default:
                throw new MetricsException("unknown metric type: " + snapshot.type());
        }
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new MetricsException("metric snapshot is missing " + field);
        }
        return value;
    }
}
