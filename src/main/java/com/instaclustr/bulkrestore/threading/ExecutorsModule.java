package com.instaclustr.bulkrestore.threading;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.instaclustr.bulkrestore.threading.Executors.FixedTasksExecutorSupplier;

public class ExecutorsModule extends AbstractModule {

    @Provides
    @Singleton
    Executors.ExecutorServiceSupplier getOperationsExecutorSupplier() {
        return new FixedTasksExecutorSupplier();
    }
}
