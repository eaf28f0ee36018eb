package dev.classifiermetrics.codec;

import static org.assertj.core.api.Assertions.*;

import dev.classifiermetrics.metric.AucMetric;
import dev.classifiermetrics.metric.ClassificationF1Metric;
import dev.classifiermetrics.metric.MetricsException;
import dev.classifiermetrics.metric.PrecisionMetric;
import dev.classifiermetrics.metric.RecallMetric;
import dev.classifiermetrics.metric.WeightedF1Metric;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricCodecTest {

    @Test
    void testShippedAucShardsMergeLikeLocalOnes() {
        // Given two workers' accumulators
        var first = AucMetric.rawDataToAuc(List.of("pos", "neg"), new double[] {0.8, 0.35}, "pos");
        var second =
                AucMetric.rawDataToAuc(List.of("neg", "pos"), new double[] {0.6, 0.1234}, "pos");

        // When one of them travels as json
        var received = MetricCodec.fromJson(MetricCodec.toJson(second), AucMetric.class);

        // Then
        assertThat(received).isEqualTo(second);
        assertThat(first.merge(received)).isEqualTo(first.merge(second));
    }

    @Test
    void testConfusionVariantIsKept() {
        var json = MetricCodec.toJson(new RecallMetric(3, 1, 0, 2));

        assertThat(json).contains("\"type\":\"recall\"").doesNotContain("perClass");
        assertThat(MetricCodec.fromJson(json)).isEqualTo(new RecallMetric(3, 1, 0, 2));
    }

    @Test
    void testWeightedF1KeepsClasses() {
        var metric =
                new WeightedF1Metric(
                        Map.of(
                                "A", new ClassificationF1Metric(1, 1, 0, 0),
                                "B", new ClassificationF1Metric(0, 1, 0, 1)));

        var decoded = MetricCodec.fromJson(MetricCodec.toJson(metric), WeightedF1Metric.class);

        assertThat(decoded).isEqualTo(metric);
        assertThat(decoded.value()).isEqualTo(metric.value());
    }

    @Test
    void testWrongTypeIsRejected() {
        var json = MetricCodec.toJson(new PrecisionMetric(1, 0, 0, 0));

        assertThatThrownBy(() -> MetricCodec.fromJson(json, RecallMetric.class))
                .isInstanceOf(MetricsException.class)
                .hasMessageContaining("RecallMetric");
    }

    @Test
    void testCorruptSnapshotsAreRejected() {
        assertThatThrownBy(() -> MetricCodec.fromJson("{\"type\":\"nope\"}"))
                .isInstanceOf(MetricsException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> MetricCodec.fromJson("{\"type\":\"f1\"}"))
                .isInstanceOf(MetricsException.class)
                .hasMessageContaining("counts");
        assertThatThrownBy(() -> MetricCodec.fromJson("not json"))
                .isInstanceOf(MetricsException.class);
        assertThatThrownBy(
                        () ->
                                MetricCodec.fromJson(
                                        "{\"type\":\"auc\",\"classLabel\":\"pos\","
                                                + "\"thresholds\":[0.1,0.5],"
                                                + "\"falsePositives\":[0,1],"
                                                + "\"truePositives\":[0,0],"
                                                + "\"positiveCount\":0,\"negativeCount\":1}"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
