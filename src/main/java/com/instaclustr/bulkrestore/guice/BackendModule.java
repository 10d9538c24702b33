package com.instaclustr.bulkrestore.guice;

import java.time.Clock;

import com.google.common.base.Ticker;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.list.DiscoveryOperation;
import com.instaclustr.bulkrestore.impl.list.DiscoveryOperationRequest;
import com.instaclustr.bulkrestore.impl.list.DynamoDbBackupLister;
import com.instaclustr.bulkrestore.impl.list.EbsBackupLister;
import com.instaclustr.bulkrestore.impl.list.Ec2BackupLister;
import com.instaclustr.bulkrestore.impl.list.ProtectionGroupBackupLister;
import com.instaclustr.bulkrestore.impl.list.RdsBackupLister;
import com.instaclustr.bulkrestore.impl.restore.DynamoDbRestoreRequestBuilder;
import com.instaclustr.bulkrestore.impl.restore.EbsRestoreRequestBuilder;
import com.instaclustr.bulkrestore.impl.restore.Ec2RestoreRequestBuilder;
import com.instaclustr.bulkrestore.impl.restore.ProtectionGroupRestoreRequestBuilder;
import com.instaclustr.bulkrestore.impl.restore.RdsRestoreRequestBuilder;
import com.instaclustr.bulkrestore.impl.restore.RestoreOperation;
import com.instaclustr.bulkrestore.impl.restore.RestoreOperationRequest;
import com.instaclustr.bulkrestore.impl.retry.RetrySpec;

import static com.instaclustr.bulkrestore.guice.ResourceTypeBindings.installBackendBindings;
import static com.instaclustr.bulkrestore.impl.ResourceType.BLOCK_VOLUME;
import static com.instaclustr.bulkrestore.impl.ResourceType.COMPUTE_INSTANCE;
import static com.instaclustr.bulkrestore.impl.ResourceType.KEY_VALUE_TABLE;
import static com.instaclustr.bulkrestore.impl.ResourceType.MANAGED_DATABASE;
import static com.instaclustr.bulkrestore.impl.ResourceType.OBJECT_PROTECTION_GROUP;
import static com.instaclustr.bulkrestore.operations.OperationBindings.installOperationBindings;

/**
 * Discovery and restore against a backend. Needs {@link ResolutionModule} for the name generator.
 */
public class BackendModule extends AbstractModule {

    private final BackendApi backendApi;
    private final RetrySpec retrySpec;

    public BackendModule(final BackendApi backendApi) {
        this(backendApi, new RetrySpec());
    }

    public BackendModule(final BackendApi backendApi, final RetrySpec retrySpec) {
        this.backendApi = backendApi;
        this.retrySpec = retrySpec;
    }

    @Override
    protected void configure() {
        bind(BackendApi.class).toInstance(backendApi);
        bind(RetrySpec.class).toInstance(retrySpec);

        installBackendBindings(binder(), BLOCK_VOLUME, EbsRestoreRequestBuilder.class, EbsBackupLister.class);
        installBackendBindings(binder(), COMPUTE_INSTANCE, Ec2RestoreRequestBuilder.class, Ec2BackupLister.class);
        installBackendBindings(binder(), MANAGED_DATABASE, RdsRestoreRequestBuilder.class, RdsBackupLister.class);
        installBackendBindings(binder(), KEY_VALUE_TABLE, DynamoDbRestoreRequestBuilder.class, DynamoDbBackupLister.class);
        installBackendBindings(binder(), OBJECT_PROTECTION_GROUP, ProtectionGroupRestoreRequestBuilder.class, ProtectionGroupBackupLister.class);

        installOperationBindings(binder(),
                                 "discover",
                                 DiscoveryOperationRequest.class,
                                 DiscoveryOperation.class);

        installOperationBindings(binder(),
                                 "restore",
                                 RestoreOperationRequest.class,
                                 RestoreOperation.class);
    }

    @Provides
    @Singleton
    Clock provideClock() {
        return Clock.systemUTC();
    }

    @Provides
    @Singleton
    Ticker provideTicker() {
        return Ticker.systemTicker();
    }
}
