package com.ivamare.topicbus.model;

import com.ivamare.topicbus.exception.InvalidHandlerOptionsException;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Execution policy options for a topic handler.
 *
 * <p>Defaults: {@code exclusive=false}, {@code timeout=600s}, {@code fork=false}.
 *
 * @param exclusive Whether the handler joins the competing-consumer group of its declaring class
 * @param timeout Maximum handler execution time
 * @param fork Whether the handler runs on an isolated executor instead of the dispatch thread
 */
public record HandlerOptions(
    boolean exclusive,
    Duration timeout,
    boolean fork
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(600);

    public static final String EXCLUSIVE = "exclusive";
    public static final String TIMEOUT = "timeout";
    public static final String FORK = "fork";

    // Always derived from the declaration call, never from caller options.
    private static final Set<String> DERIVED_KEYS = Set.of("handler", "subscriber", "type");

    public HandlerOptions {
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new InvalidHandlerOptionsException("timeout must be positive, got " + timeout);
        }
    }

    /**
     * Options with all defaults applied.
     */
    public static HandlerOptions defaults() {
        return new HandlerOptions(false, DEFAULT_TIMEOUT, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build options from a loosely typed map, merging over the defaults.
     *
     * <p>Recognized keys are {@code exclusive} (Boolean), {@code timeout}
     * (seconds as a Number, or a Duration) and {@code fork} (Boolean). The keys
     * {@code handler}, {@code subscriber} and {@code type} are ignored. Any other
     * key is rejected.
     *
     * @param options caller options (may be null)
     * @return merged options
     * @throws InvalidHandlerOptionsException on unknown keys or wrongly typed values
     */
    public static HandlerOptions fromMap(Map<String, ?> options) {
        Builder builder = builder();
        if (options == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (DERIVED_KEYS.contains(key)) {
                continue;
            }
            switch (key) {
                case EXCLUSIVE -> builder.exclusive(asBoolean(key, value));
                case FORK -> builder.fork(asBoolean(key, value));
                case TIMEOUT -> builder.timeout(asDuration(value));
                default -> throw new InvalidHandlerOptionsException("Unknown handler option: " + key);
            }
        }
        return builder.build();
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new InvalidHandlerOptionsException(key + " must be a boolean, got " + value);
    }

    private static Duration asDuration(Object value) {
        if (value instanceof Duration d) {
            return d;
        }
        if (value instanceof Number n) {
            return Duration.ofMillis(Math.round(n.doubleValue() * 1000));
        }
        throw new InvalidHandlerOptionsException("timeout must be seconds or a Duration, got " + value);
    }

    /**
     * Builder for {@link HandlerOptions}.
     */
    public static class Builder {

        private boolean exclusive = false;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean fork = false;

        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutSeconds(long seconds) {
            this.timeout = Duration.ofSeconds(seconds);
            return this;
        }

        public Builder fork(boolean fork) {
            this.fork = fork;
            return this;
        }

        public HandlerOptions build() {
            return new HandlerOptions(exclusive, timeout, fork);
        }
    }
}
