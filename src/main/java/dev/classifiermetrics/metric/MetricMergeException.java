package dev.classifiermetrics.metric;

/** Thrown when two accumulators that cannot be combined are merged. */
public class MetricMergeException extends MetricsException {

    public MetricMergeException(String message) {
        super(message);
    }
}
