package com.instaclustr.bulkrestore.guice;

import java.security.SecureRandom;
import java.util.Random;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.instaclustr.bulkrestore.impl.resolve.DynamoDbTargetSpecResolver;
import com.instaclustr.bulkrestore.impl.resolve.EbsTargetSpecResolver;
import com.instaclustr.bulkrestore.impl.resolve.Ec2TargetSpecResolver;
import com.instaclustr.bulkrestore.impl.resolve.FormatOperation;
import com.instaclustr.bulkrestore.impl.resolve.FormatOperationRequest;
import com.instaclustr.bulkrestore.impl.resolve.ProtectionGroupTargetSpecResolver;
import com.instaclustr.bulkrestore.impl.resolve.RdsTargetSpecResolver;
import com.instaclustr.bulkrestore.impl.resolve.ValidateOperation;
import com.instaclustr.bulkrestore.impl.resolve.ValidateOperationRequest;

import static com.instaclustr.bulkrestore.guice.ResourceTypeBindings.installResolverBinding;
import static com.instaclustr.bulkrestore.impl.ResourceType.BLOCK_VOLUME;
import static com.instaclustr.bulkrestore.impl.ResourceType.COMPUTE_INSTANCE;
import static com.instaclustr.bulkrestore.impl.ResourceType.KEY_VALUE_TABLE;
import static com.instaclustr.bulkrestore.impl.ResourceType.MANAGED_DATABASE;
import static com.instaclustr.bulkrestore.impl.ResourceType.OBJECT_PROTECTION_GROUP;
import static com.instaclustr.bulkrestore.operations.OperationBindings.installOperationBindings;

/**
 * Target spec resolution and input validation, none of it needs the backend.
 */
public class ResolutionModule extends AbstractModule {

    @Override
    protected void configure() {
        installResolverBinding(binder(), BLOCK_VOLUME, EbsTargetSpecResolver.class);
        installResolverBinding(binder(), COMPUTE_INSTANCE, Ec2TargetSpecResolver.class);
        installResolverBinding(binder(), MANAGED_DATABASE, RdsTargetSpecResolver.class);
        installResolverBinding(binder(), KEY_VALUE_TABLE, DynamoDbTargetSpecResolver.class);
        installResolverBinding(binder(), OBJECT_PROTECTION_GROUP, ProtectionGroupTargetSpecResolver.class);

        installOperationBindings(binder(),
                                 "validate",
                                 ValidateOperationRequest.class,
                                 ValidateOperation.class);

        installOperationBindings(binder(),
                                 "format",
                                 FormatOperationRequest.class,
                                 FormatOperation.class);
    }

    @Provides
    @Singleton
    Random provideRandom() {
        return new SecureRandom();
    }
}
