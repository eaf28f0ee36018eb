package dev.classifiermetrics.classifier;

import static org.assertj.core.api.Assertions.*;

import dev.classifiermetrics.config.ClassifierConfig;
import dev.classifiermetrics.metric.AucMetric;
import dev.classifiermetrics.metric.WeightedF1Metric;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClassifierMetricsTest {
    private static final double TOLERANCE = 1e-9;

    private static ClassifierMetrics binary() {
        return ClassifierMetrics.builder().classes("pos", "neg").areaUnderCurve(true).build();
    }

    @Test
    void testRefClassMovesToFront() {
        var metrics = ClassifierMetrics.builder().classes("a", "b", "c").refClass("c").build();

        assertThat(metrics.classes()).containsExactly("c", "a", "b");
        assertThat(metrics.refClass()).isEqualTo("c");
    }

    @Test
    void testUnknownRefClassFallsBackToFirst() {
        var metrics = ClassifierMetrics.builder().classes("a", "b").refClass("z").build();

        assertThat(metrics.refClass()).isEqualTo("a");
    }

    @Test
    void testBinaryPredictionUsesThreshold() {
        var metrics =
                ClassifierMetrics.builder().classes("pos", "neg").threshold(0.7).build();

        var predictions =
                metrics.predict(
                        new double[][] {{0.9, 0.1}, {0.7, 0.3}, {0.6, 0.4}, {0.2, 0.8}});

        assertThat(predictions).containsExactly("pos", "neg", "neg", "neg");
    }

    @Test
    void testMultiClassPredictionIsArgmax() {
        var metrics = ClassifierMetrics.builder().classes("a", "b", "c").build();

        var predictions =
                metrics.predict(new double[][] {{0.2, 0.5, 0.3}, {0.1, 0.1, 0.8}, {0.4, 0.4, 0.2}});

        assertThat(predictions).containsExactly("b", "c", "a");
    }

    @Test
    void testRowWidthMustMatchClasses() {
        var metrics = binary();

        assertThatThrownBy(() -> metrics.predict(new double[][] {{0.2, 0.5, 0.3}}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEvalStepRecordsEveryMetric() {
        // Given
        var metrics = binary();
        var gold = List.of("pos", "neg", "neg", "pos");
        var rows = new double[][] {{0.9, 0.1}, {0.2, 0.8}, {0.7, 0.3}, {0.4, 0.6}};

        // When
        var predictions = metrics.evalStep(gold, rows);

        // Then
        assertThat(predictions).containsExactly("pos", "neg", "pos", "neg");
        var report = metrics.report();
        assertThat(report)
                .containsOnlyKeys(
                        "auc",
                        "class_neg_f1",
                        "class_neg_prec",
                        "class_neg_recall",
                        "class_pos_f1",
                        "class_pos_prec",
                        "class_pos_recall",
                        "weighted_f1");
        assertThat(report.get("class_pos_prec")).isCloseTo(0.5, within(TOLERANCE));
        assertThat(report.get("class_pos_recall")).isCloseTo(0.5, within(TOLERANCE));
        assertThat(report.get("class_neg_f1")).isCloseTo(0.5, within(TOLERANCE));
        assertThat(report.get("weighted_f1")).isCloseTo(0.5, within(TOLERANCE));
        assertThat(report.get("auc")).isCloseTo(0.75, within(TOLERANCE));
    }

    @Test
    void testStepsAccumulate() {
        var metrics = binary();

        metrics.evalStep(List.of("pos", "neg"), new double[][] {{0.9, 0.1}, {0.2, 0.8}});
        metrics.evalStep(List.of("neg", "pos"), new double[][] {{0.7, 0.3}, {0.4, 0.6}});

        var weighted =
                metrics.registry().get(ClassifierMetrics.WEIGHTED_F1, WeightedF1Metric.class);
        assertThat(weighted).isPresent();
        assertThat(weighted.get().perClass().get("pos").counts().total()).isEqualTo(4);
        var auc = metrics.registry().get(ClassifierMetrics.AUC, AucMetric.class).orElseThrow();
        assertThat(auc.positiveCount()).isEqualTo(2);
        assertThat(auc.negativeCount()).isEqualTo(2);
        assertThat(auc.value()).isCloseTo(0.75, within(TOLERANCE));
    }

    @Test
    void testUnknownLabelIsReported() {
        var metrics = binary();

        assertThatThrownBy(
                        () ->
                                metrics.recordConfusion(
                                        List.of("pos", "neg"), List.of("pos", "maybe")))
                .isInstanceOfSatisfying(
                        UnknownLabelException.class,
                        e -> {
                            assertThat(e.getLabel()).isEqualTo("maybe");
                            assertThat(e.getClasses()).containsExactly("pos", "neg");
                        });
        assertThat(metrics.registry().size()).isZero();
    }

    @Test
    void testRejectedStepRecordsNothing() {
        // Given
        var metrics = binary();

        // When: the row predicts fine but is not a valid probability for the AUC
        assertThatThrownBy(() -> metrics.evalStep(List.of("pos"), new double[][] {{1.2, -0.2}}))
                .isInstanceOf(IllegalArgumentException.class);

        // Then
        assertThat(metrics.registry().size()).isZero();
        assertThat(metrics.report()).isEmpty();
    }

    @Test
    void testBuilderRejectsOutOfRangeSettings() {
        assertThatThrownBy(
                        () ->
                                ClassifierMetrics.builder()
                                        .classes("a", "b")
                                        .threshold(1.5)
                                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threshold");
        assertThatThrownBy(
                        () ->
                                ClassifierMetrics.builder()
                                        .classes("a", "b")
                                        .threshold(Double.NaN)
                                        .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(
                        () ->
                                ClassifierMetrics.builder()
                                        .classes("a", "b")
                                        .aucDecimalPlaces(10)
                                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("decimal places");
        assertThat(ClassifierMetrics.builder().classes("a", "b").threshold(1.0).build().classes())
                .containsExactly("a", "b");
    }

    @Test
    void testAucOnlyForBinaryClassifiers() {
        var metrics =
                ClassifierMetrics.builder().classes("a", "b", "c").areaUnderCurve(true).build();

        metrics.evalStep(List.of("a", "b"), new double[][] {{0.8, 0.1, 0.1}, {0.3, 0.6, 0.1}});

        assertThat(metrics.areaUnderCurve()).isFalse();
        assertThat(metrics.report()).doesNotContainKey(ClassifierMetrics.AUC);
        assertThat(metrics.report().get("class_a_prec")).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    void testBuildFromConfig() {
        var config =
                ClassifierConfig.of(
                        "CLASSIFIER_CLASSES", "neg,pos",
                        "CLASSIFIER_REF_CLASS", "pos",
                        "CLASSIFIER_AREA_UNDER_CURVE", "true");

        var metrics = ClassifierMetrics.of(config);
        metrics.evalStep(List.of("pos", "neg"), new double[][] {{0.9, 0.1}, {0.1, 0.9}});

        assertThat(metrics.classes()).containsExactly("pos", "neg");
        assertThat(metrics.report().get(ClassifierMetrics.AUC)).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    void testReset() {
        var metrics = binary();
        metrics.evalStep(List.of("pos"), new double[][] {{0.9, 0.1}});

        metrics.reset();

        assertThat(metrics.report()).isEmpty();
    }
}
