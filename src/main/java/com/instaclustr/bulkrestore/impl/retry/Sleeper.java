package com.instaclustr.bulkrestore.impl.retry;

import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.Uninterruptibles;

public interface Sleeper {

    void sleep();

    /**
     * Doubles its interval after every sleep. Not thread-safe, one instance serves a single retried call.
     */
    class ExponentialSleeper implements Sleeper {

        private long interval;

        public ExponentialSleeper(final long intervalMillis) {
            this.interval = intervalMillis;
        }

        @Override
        public void sleep() {
            Uninterruptibles.sleepUninterruptibly(interval, TimeUnit.MILLISECONDS);
            interval *= 2;
        }

        long getInterval() {
            return interval;
        }
    }

    class LinearSleeper implements Sleeper {

        private final long interval;

        public LinearSleeper(final long intervalMillis) {
            this.interval = intervalMillis;
        }

        @Override
        public void sleep() {
            Uninterruptibles.sleepUninterruptibly(interval, TimeUnit.MILLISECONDS);
        }
    }
}
