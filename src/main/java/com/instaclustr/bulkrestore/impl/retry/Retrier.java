package com.instaclustr.bulkrestore.impl.retry;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-runs a backend call which failed with {@link RetriableException}. Any other exception is propagated
 * on its first occurrence.
 */
public interface Retrier {

    <T> T submit(final Callable<T> c) throws Exception;

    class DefaultRetrier implements Retrier {

        private static final Logger logger = LoggerFactory.getLogger(DefaultRetrier.class);

        private final int maxAttempts;
        protected final RetrySpec retrySpec;
        protected final Supplier<Sleeper> sleeperSupplier;

        /**
         * @param sleeperSupplier called once per {@link #submit(Callable)}, concurrent submissions do not share
         *                        a sleeper
         */
        public DefaultRetrier(final RetrySpec retrySpec, final Supplier<Sleeper> sleeperSupplier) {
            this.retrySpec = retrySpec;
            this.sleeperSupplier = sleeperSupplier;
            this.maxAttempts = retrySpec.maxAttempts;
        }

        @Override
        public <T> T submit(final Callable<T> c) throws Exception {
            final Sleeper sleeper = sleeperSupplier.get();

            int attempts = 0;

            while (true) {
                try {
                    return c.call();
                } catch (final RetriableException ex) {
                    attempts += 1;
                    if (attempts >= maxAttempts) {
                        throw ex;
                    }
                    logger.warn("Attempt {} of {} failed, this call will be retried: {}", attempts, maxAttempts, ex.getMessage());
                    sleeper.sleep();
                }
            }
        }
    }

    class RetriableException extends RuntimeException {

        public RetriableException(final String message) {
            super(message);
        }

        public RetriableException(final String message, final Throwable cause) {
            super(message, cause);
        }
    }
}
