package dev.classifiermetrics.config;

import dev.classifiermetrics.metric.AucMetric;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Settings of classifier evaluation bookkeeping. */
@Getter
@Accessors(fluent = true)
public final class ClassifierConfig extends BaseConfig {
    /** The class vocabulary, in declaration order. */
    private final List<String> classes = getRequiredListConfig("CLASSIFIER_CLASSES");

    /** Class used for binary thresholding and AUC. Defaults to the first class. */
    private final Optional<String> refClass =
            Optional.ofNullable(getConfig("CLASSIFIER_REF_CLASS", null, String.class))
                    .map(String::trim);

    /** Probability the reference class must exceed to be predicted. Binary only. */
    private final double threshold = getConfig("CLASSIFIER_THRESHOLD", 0.5);

    /** Whether to also accumulate the area under the ROC curve. Binary only. */
    private final boolean areaUnderCurve = getConfig("CLASSIFIER_AREA_UNDER_CURVE", false);

    private final int aucDecimalPlaces =
            getConfig("CLASSIFIER_AUC_DECIMAL_PLACES", AucMetric.DEFAULT_DECIMAL_PLACES);

    public static ClassifierConfig fromEnvironment() {
        return of();
    }

    public static ClassifierConfig of(String... overrides) {
        if (overrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(overrides[overrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < overrides.length; i += 2) {
            overridesMap.put(overrides[i], overrides[i + 1]);
        }
        return new ClassifierConfig(overridesMap);
    }

    private ClassifierConfig(Map<String, String> overrides) {
        super(overrides);
        if (new HashSet<>(classes).size() != classes.size()) {
            throw new IllegalArgumentException("CLASSIFIER_CLASSES has duplicates: " + classes);
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException(
                    "CLASSIFIER_THRESHOLD must be within [0, 1]: " + threshold);
        }
        if (aucDecimalPlaces < 0 || aucDecimalPlaces > AucMetric.MAX_DECIMAL_PLACES) {
            throw new IllegalArgumentException(
                    "CLASSIFIER_AUC_DECIMAL_PLACES must be within [0, %d]: %d"
                            .formatted(AucMetric.MAX_DECIMAL_PLACES, aucDecimalPlaces));
        }
    }
}
