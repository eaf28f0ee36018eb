package dev.classifiermetrics.config;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ClassifierConfigTest {

    @Test
    void testDefaults() {
        var config = ClassifierConfig.of("CLASSIFIER_CLASSES", "pos,neg");

        assertThat(config.classes()).containsExactly("pos", "neg");
        assertThat(config.refClass()).isEmpty();
        assertThat(config.threshold()).isEqualTo(0.5);
        assertThat(config.areaUnderCurve()).isFalse();
        assertThat(config.aucDecimalPlaces()).isEqualTo(3);
    }

    @Test
    void testOverrides() {
        var config =
                ClassifierConfig.of(
                        "CLASSIFIER_CLASSES", "cat, dog",
                        "CLASSIFIER_REF_CLASS", " dog ",
                        "CLASSIFIER_THRESHOLD", "0.7",
                        "CLASSIFIER_AREA_UNDER_CURVE", "true",
                        "CLASSIFIER_AUC_DECIMAL_PLACES", "2");

        assertThat(config.classes()).containsExactly("cat", "dog");
        assertThat(config.refClass()).hasValue("dog");
        assertThat(config.threshold()).isEqualTo(0.7);
        assertThat(config.areaUnderCurve()).isTrue();
        assertThat(config.aucDecimalPlaces()).isEqualTo(2);
    }

    @Test
    void testClassesAreRequired() {
        assertThatThrownBy(
                        () -> ClassifierConfig.of("CLASSIFIER_CLASSES", BaseConfig.UNSET))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CLASSIFIER_CLASSES");
    }

    @Test
    void testInvalidSettingsAreRejected() {
        assertThatThrownBy(() -> ClassifierConfig.of("CLASSIFIER_CLASSES", "a,b,a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicates");
        assertThatThrownBy(
                        () ->
                                ClassifierConfig.of(
                                        "CLASSIFIER_CLASSES", "a,b", "CLASSIFIER_THRESHOLD", "1.5"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(
                        () ->
                                ClassifierConfig.of(
                                        "CLASSIFIER_CLASSES",
                                        "a,b",
                                        "CLASSIFIER_AUC_DECIMAL_PLACES",
                                        "-1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDanglingOverrideKey() {
        assertThatThrownBy(() -> ClassifierConfig.of("CLASSIFIER_CLASSES"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dangling");
    }
}
