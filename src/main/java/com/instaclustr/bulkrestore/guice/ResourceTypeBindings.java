package com.instaclustr.bulkrestore.guice;

import com.google.inject.Binder;
import com.google.inject.multibindings.MapBinder;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.list.BackupLister;
import com.instaclustr.bulkrestore.impl.resolve.TargetSpecResolver;
import com.instaclustr.bulkrestore.impl.restore.RestoreRequestBuilder;

/**
 * Registers per resource type implementations into {@code Map<ResourceType, ...>} bindings.
 */
public final class ResourceTypeBindings {

    private ResourceTypeBindings() {
    }

    public static <RESOLVER extends TargetSpecResolver>
    void installResolverBinding(final Binder binder,
                                final ResourceType resourceType,
                                final Class<RESOLVER> resolverClass) {
        MapBinder.newMapBinder(binder, ResourceType.class, TargetSpecResolver.class)
            .addBinding(resourceType).to(resolverClass);
    }

    /**
     * Both the request builder and the lister talk to the backend, they are installed only where a
     * {@link com.instaclustr.bulkrestore.impl.backend.BackendApi} is bound.
     */
    public static <BUILDER extends RestoreRequestBuilder, LISTER extends BackupLister>
    void installBackendBindings(final Binder binder,
                                final ResourceType resourceType,
                                final Class<BUILDER> builderClass,
                                final Class<LISTER> listerClass) {
        MapBinder.newMapBinder(binder, ResourceType.class, RestoreRequestBuilder.class)
            .addBinding(resourceType).to(builderClass);

        MapBinder.newMapBinder(binder, ResourceType.class, BackupLister.class)
            .addBinding(resourceType).to(listerClass);
    }
}
