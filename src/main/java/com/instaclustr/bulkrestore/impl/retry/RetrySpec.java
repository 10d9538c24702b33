package com.instaclustr.bulkrestore.impl.retry;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.measure.Time;
import com.instaclustr.bulkrestore.measure.TimeMeasureTypeConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Option;

/**
 * Retry policy of environment and bucket lookups. Restore submissions and task reads are never retried.
 */
public class RetrySpec {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    @Option(names = "--retry-interval",
        defaultValue = "1s",
        converter = TimeMeasureTypeConverter.class,
        description = "interval between attempts of a failed lookup, defaults to 1s")
    @JsonProperty("interval")
    public Time interval;

    @Option(names = "--retry-strategy",
        defaultValue = "linear",
        description = "strategy to use for retries, either 'linear' or 'exponential', defaults to 'linear'",
        converter = RetryStrategyConverter.class)
    @JsonProperty("strategy")
    public RetryStrategy strategy;

    @Option(names = "--retry-max-attempts",
        defaultValue = "5",
        description = "number of attempts of a lookup, defaults to 5")
    @JsonProperty("max_attempts")
    public int maxAttempts;

    @Option(names = "--retry-enabled",
        negatable = true,
        defaultValue = "true",
        description = "flag telling if lookups are retried, defaults to true")
    @JsonProperty("enabled")
    public boolean enabled;

    @JsonCreator
    public RetrySpec(@JsonProperty("interval") final Time interval,
                     @JsonProperty("strategy") final RetryStrategy strategy,
                     @JsonProperty("max_attempts") final Integer maxAttempts,
                     @JsonProperty("enabled") final Boolean enabled) {
        this.interval = interval == null ? Time.seconds(1) : interval;
        this.strategy = strategy == null ? RetryStrategy.LINEAR : strategy;
        this.enabled = enabled == null || enabled;
        this.maxAttempts = maxAttempts == null || maxAttempts < 1 ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
    }

    public RetrySpec() {
        this(null, null, null, null);
    }

    public void validate() {
        if (strategy == null) {
            strategy = RetryStrategy.LINEAR;
        }
        if (interval == null) {
            interval = Time.seconds(1);
        }
        if (maxAttempts < 1) {
            maxAttempts = DEFAULT_MAX_ATTEMPTS;
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("interval", interval)
            .add("strategy", strategy)
            .add("maxAttempts", maxAttempts)
            .add("enabled", enabled)
            .toString();
    }

    private static class RetryStrategyConverter implements CommandLine.ITypeConverter<RetryStrategy> {

        @Override
        public RetryStrategy convert(final String value) {
            return RetryStrategy.parse(value);
        }
    }

    public enum RetryStrategy {
        EXPONENTIAL,
        LINEAR;

        private static final Logger logger = LoggerFactory.getLogger(RetryStrategy.class);
        public static final RetryStrategy DEFAULT_STRATEGY = LINEAR;

        @JsonCreator
        public static RetryStrategy parse(final String value) {
            if (value == null || value.trim().isEmpty()) {
                return RetryStrategy.DEFAULT_STRATEGY;
            }

            for (final RetryStrategy strategy : RetryStrategy.values()) {
                if (strategy.name().equalsIgnoreCase(value.trim())) {
                    return strategy;
                }
            }

            logger.info("Unable to parse retry strategy for value '{}', possible strategies: {}, returning default strategy {}",
                        value,
                        Arrays.toString(RetryStrategy.values()),
                        RetryStrategy.DEFAULT_STRATEGY);

            return RetryStrategy.DEFAULT_STRATEGY;
        }

        @JsonValue
        public String toValue() {
            return name().toLowerCase();
        }
    }
}
