package com.instaclustr.bulkrestore.impl.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.list.DiscoveryResult;
import com.instaclustr.bulkrestore.impl.list.DiscoveryResult.RegionBackups;
import com.instaclustr.bulkrestore.impl.record.BackupRecord;
import com.instaclustr.bulkrestore.impl.spec.RestoreGroup;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;
import com.instaclustr.bulkrestore.impl.spec.TargetSpecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.String.format;

/**
 * Pairs every discovered backup with its resolved target spec.
 */
public class RestoreGroupFormatter {

    private static final Logger logger = LoggerFactory.getLogger(RestoreGroupFormatter.class);

    private final Map<ResourceType, TargetSpecResolver> resolvers;

    @Inject
    public RestoreGroupFormatter(final Map<ResourceType, TargetSpecResolver> resolvers) {
        this.resolvers = resolvers;
    }

    public List<RestoreGroup> toRestoreGroups(final DiscoveryResult discovery, final TargetSpecs targetSpecs) {
        final List<RestoreGroup> groups = new ArrayList<>();

        for (final RegionBackups region : discovery.getRegions()) {
            for (final Map.Entry<ResourceType, List<BackupRecord>> entry : region.getBackups().entrySet()) {
                final TargetSpecResolver resolver = resolvers.get(entry.getKey());

                if (resolver == null) {
                    throw new IllegalStateException(format("There is no target spec resolver registered for %s", entry.getKey()));
                }

                final TargetSpec spec = targetSpecs.forResourceType(entry.getKey());

                for (final BackupRecord record : entry.getValue()) {
                    final String sourceAccount = record.getSourceAccount() == null ? discovery.getSourceAccount() : record.getSourceAccount();
                    final boolean crossAccount = RestoreGroup.isCrossAccount(spec, sourceAccount);

                    groups.add(new RestoreGroup(entry.getKey(),
                                                sourceAccount,
                                                region.getRegion(),
                                                record,
                                                resolver.resolve(spec, record, crossAccount)));
                }
            }
        }

        logger.info("Formatted {} restore groups from {} regions", groups.size(), discovery.getRegions().size());

        return groups;
    }
}
