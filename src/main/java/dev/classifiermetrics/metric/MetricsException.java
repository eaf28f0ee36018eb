package dev.classifiermetrics.metric;

/** Base class of every exception raised by the metrics library. */
public class MetricsException extends RuntimeException {

    public MetricsException(String message) {
        super(message);
    }

    public MetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
