package com.instaclustr.bulkrestore.impl.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.measure.Time;
import com.instaclustr.bulkrestore.measure.TimeMeasureTypeConverter;
import picocli.CommandLine.Option;

/**
 * Budget of polling a restore task: reads are done every {@code interval} until {@code timeout} elapses.
 */
public class PollingSpec {

    public static final Time DEFAULT_TIMEOUT = Time.minutes(10);
    public static final Time DEFAULT_INTERVAL = Time.seconds(20);

    @Option(names = "--poll-timeout",
        defaultValue = "10m",
        converter = TimeMeasureTypeConverter.class,
        description = "time after which a restore task which is not done is reported as timed out, defaults to 10m")
    @JsonProperty("timeout")
    public Time timeout;

    @Option(names = "--poll-interval",
        defaultValue = "20s",
        converter = TimeMeasureTypeConverter.class,
        description = "interval between two reads of a restore task status, defaults to 20s")
    @JsonProperty("interval")
    public Time interval;

    @JsonCreator
    public PollingSpec(@JsonProperty("timeout") final Time timeout,
                       @JsonProperty("interval") final Time interval) {
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.interval = interval == null ? DEFAULT_INTERVAL : interval;
    }

    public PollingSpec() {
        this(null, null);
    }

    public void validate() {
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (interval == null) {
            interval = DEFAULT_INTERVAL;
        }
        if (interval.toMilliseconds() <= 0) {
            throw new ValidationException("interval", "polling interval has to be positive");
        }
        if (timeout.toMilliseconds() < 0) {
            throw new ValidationException("timeout", "polling timeout can not be negative");
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("timeout", timeout)
            .add("interval", interval)
            .toString();
    }
}
