package com.instaclustr.bulkrestore.operations;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

public class OperationsModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(OperationsService.class).in(Singleton.class);
    }
}
