package dev.classifiermetrics.config;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Reads settings from explicit overrides first, then from the process environment. */
class BaseConfig {
    /** Override value that hides an environment variable. Only used for testing. */
    static final String UNSET = "CLASSIFIER_METRICS_UNSET_" + System.nanoTime();

    protected final Map<String, String> overrides;

    BaseConfig(Map<String, String> overrides) {
        this.overrides = Map.copyOf(overrides);
    }

    @SuppressWarnings("unchecked")
    protected <T> @Nonnull T getConfig(@Nonnull String name, @Nonnull T defaultValue) {
        Objects.requireNonNull(defaultValue);
        return Objects.requireNonNull(
                getConfig(name, defaultValue, (Class<T>) defaultValue.getClass()));
    }

    protected <T> @Nullable T getConfig(
            @Nonnull String name, @Nullable T defaultValue, @Nonnull Class<T> type) {
        var raw = lookup(name);
        return raw == null ? defaultValue : parse(name, raw, type);
    }

    protected @Nonnull String getRequiredConfig(@Nonnull String name) {
        var value = getConfig(name, null, String.class);
        if (value == null) {
            throw new IllegalArgumentException("%s is required".formatted(name));
        }
        return value;
    }

    /** A comma separated list. Blank entries are dropped and the rest trimmed. */
    protected @Nonnull List<String> getRequiredListConfig(@Nonnull String name) {
        var values =
                Arrays.stream(getRequiredConfig(name).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
        if (values.isEmpty()) {
            throw new IllegalArgumentException("%s must list at least one value".formatted(name));
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    protected <T> T parse(@Nonnull String name, @Nonnull String raw, @Nonnull Class<T> type) {
        try {
            if (type == String.class) {
                return (T) raw;
            } else if (type == Boolean.class || type == boolean.class) {
                return (T) Boolean.valueOf(raw.trim());
            } else if (type == Integer.class || type == int.class) {
                return (T) Integer.valueOf(raw.trim());
            } else if (type == Double.class || type == double.class) {
                return (T) Double.valueOf(raw.trim());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "%s is not a valid %s: %s".formatted(name, type.getSimpleName(), raw), e);
        }
        throw new IllegalArgumentException(
                "unsupported setting type %s for %s".formatted(type.getName(), name));
    }

    protected @Nullable String lookup(@Nonnull String name) {
        var value = overrides.get(name);
        if (value == null) {
            value = System.getenv(name);
        }
        if (value == null || UNSET.equals(value) || value.isBlank()) {
            return null;
        }
        return value;
    }
}
