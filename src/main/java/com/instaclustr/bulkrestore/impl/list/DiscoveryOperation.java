package com.instaclustr.bulkrestore.impl.list;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import javax.inject.Inject;

import com.google.common.collect.ImmutableList;
import com.google.inject.assistedinject.Assisted;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.list.DiscoveryResult.RegionBackups;
import com.instaclustr.bulkrestore.impl.record.BackupRecord;
import com.instaclustr.bulkrestore.operations.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.String.format;

/**
 * Discovers backups of the requested resource types in the source region, or in every region of the source
 * account. An empty result is not an error.
 */
public class DiscoveryOperation extends Operation<DiscoveryOperationRequest> {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryOperation.class);

    private final Map<ResourceType, BackupLister> listers;
    private final RegionLister regionLister;

    @Inject
    public DiscoveryOperation(@Assisted final DiscoveryOperationRequest request,
                              final Map<ResourceType, BackupLister> listers,
                              final RegionLister regionLister) {
        super(request);
        this.listers = listers;
        this.regionLister = regionLister;
    }

    @Override
    protected void run0() throws Exception {
        final List<String> regions = request.allRegions
            ? new ArrayList<>(regionLister.listRegions(request.discovery.sourceAccount).keySet())
            : ImmutableList.of(request.discovery.sourceRegion);

        final List<RegionBackups> result = new ArrayList<>();

        for (final String region : regions) {
            final DiscoverySpec regionSpec = request.discovery.forRegion(region);
            final Map<ResourceType, List<BackupRecord>> backups = new EnumMap<>(ResourceType.class);

            for (final ResourceType resourceType : request.effectiveResourceTypes()) {
                final BackupLister lister = listers.get(resourceType);

                if (lister == null) {
                    throw new IllegalStateException(format("There is no backup lister for resource type %s", resourceType));
                }

                final List<? extends BackupRecord> records = lister.list(regionSpec);

                if (!records.isEmpty()) {
                    backups.put(resourceType, new ArrayList<>(records));
                }
            }

            result.add(new RegionBackups(region, backups));
        }

        request.response = new DiscoveryResult(request.discovery.sourceAccount, result);

        if (request.response.size() == 0) {
            logger.info("No backups were found in account {} for regions {}", request.discovery.sourceAccount, regions);
        } else {
            logger.info("Discovered {} backups in account {}", request.response.size(), request.discovery.sourceAccount);
        }
    }
}
