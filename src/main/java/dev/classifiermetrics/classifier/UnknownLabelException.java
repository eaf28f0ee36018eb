package dev.classifiermetrics.classifier;

import dev.classifiermetrics.metric.MetricsException;
import java.util.List;
import lombok.Getter;

/** Thrown when a predicted or gold label is not part of the configured class vocabulary. */
@Getter
public class UnknownLabelException extends MetricsException {
    private final String label;
    private final List<String> classes;

    public UnknownLabelException(String label, List<String> classes) {
        super("label %s is not in the class list %s".formatted(label, classes));
        this.label = label;
        this.classes = List.copyOf(classes);
    }
}
