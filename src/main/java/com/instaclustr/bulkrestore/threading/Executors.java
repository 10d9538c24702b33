package com.instaclustr.bulkrestore.threading;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

public abstract class Executors {

    public static final Integer DEFAULT_CONCURRENT_OPERATIONS = 10;

    public static final class FixedTasksExecutorSupplier extends ExecutorServiceSupplier {

        @Override
        public ListeningExecutorService get(final Integer concurrentTasks) {
            final int size = concurrentTasks != null && concurrentTasks > 0 ? concurrentTasks : DEFAULT_CONCURRENT_OPERATIONS;

            return MoreExecutors.listeningDecorator(java.util.concurrent.Executors.newFixedThreadPool(size, new ThreadFactoryBuilder()
                .setNameFormat("bulk-restore-%d")
                .setDaemon(true)
                .build()));
        }
    }

    public static abstract class ExecutorServiceSupplier {

        public ListeningExecutorService get() {
            return get(DEFAULT_CONCURRENT_OPERATIONS);
        }

        public abstract ListeningExecutorService get(final Integer concurrentTasks);
    }
}
