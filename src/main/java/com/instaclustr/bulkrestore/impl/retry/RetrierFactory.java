package com.instaclustr.bulkrestore.impl.retry;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

import com.instaclustr.bulkrestore.impl.retry.Retrier.DefaultRetrier;
import com.instaclustr.bulkrestore.impl.retry.Sleeper.ExponentialSleeper;
import com.instaclustr.bulkrestore.impl.retry.Sleeper.LinearSleeper;

import static com.instaclustr.bulkrestore.impl.retry.RetrySpec.RetryStrategy.EXPONENTIAL;
import static com.instaclustr.bulkrestore.impl.retry.RetrySpec.RetryStrategy.LINEAR;
import static java.lang.String.format;

public class RetrierFactory {

    private static final class NoOpRetrier implements Retrier {

        @Override
        public <T> T submit(final Callable<T> c) throws Exception {
            return c.call();
        }
    }

    public static Retrier getRetrier(final RetrySpec retrySpec) {
        if (retrySpec == null || !retrySpec.enabled || retrySpec.strategy == null) {
            return new NoOpRetrier();
        }
        final long interval = retrySpec.interval.toMilliseconds();
        if (retrySpec.strategy == EXPONENTIAL) {
            return createRetrier(retrySpec, () -> new ExponentialSleeper(interval));
        }
        return createRetrier(retrySpec, () -> new LinearSleeper(interval));
    }

    public static Retrier getRetrier(final RetrySpec retrySpec, final Sleeper sleeper) {
        return createRetrier(retrySpec, () -> sleeper);
    }

    private static Retrier createRetrier(final RetrySpec retrySpec, final Supplier<Sleeper> sleeperSupplier) {
        if (retrySpec == null || !retrySpec.enabled) {
            return new NoOpRetrier();
        }
        if (retrySpec.strategy == LINEAR || retrySpec.strategy == EXPONENTIAL) {
            return new DefaultRetrier(retrySpec, sleeperSupplier);
        }
        throw new IllegalStateException(format("Unable to construct a retrier of strategy %s", retrySpec.strategy));
    }
}
