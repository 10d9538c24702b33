package com.instaclustr.bulkrestore.impl.list;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.NotFoundException;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.backend.ProtectionGroup;
import com.instaclustr.bulkrestore.impl.backend.ProtectionGroupBackup;
import com.instaclustr.bulkrestore.impl.backend.ProtectionGroupS3Asset;
import com.instaclustr.bulkrestore.impl.filter.FilterExpression;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder.TimeWindow;
import com.instaclustr.bulkrestore.impl.record.ProtectionGroupBackupRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.lang.String.format;
import static java.util.stream.Collectors.toList;

/**
 * Lists backups of a protection group found by its name. Only the first backup in search order is
 * returned, every backup of a group restores the same buckets.
 */
public class ProtectionGroupBackupLister implements BackupLister {

    private static final Logger logger = LoggerFactory.getLogger(ProtectionGroupBackupLister.class);

    static final String PROTECTION_GROUP_ID = "protection_group_id";

    private final BackendApi backendApi;
    private final TimeWindowFilterBuilder timeWindowFilterBuilder;

    @Inject
    public ProtectionGroupBackupLister(final BackendApi backendApi, final TimeWindowFilterBuilder timeWindowFilterBuilder) {
        this.backendApi = backendApi;
        this.timeWindowFilterBuilder = timeWindowFilterBuilder;
    }

    @Override
    public List<ProtectionGroupBackupRecord> list(final DiscoverySpec spec) {
        spec.validate();

        if (isNullOrEmpty(spec.protectionGroupName)) {
            throw new ValidationException("search_pg_name", "search_pg_name has to be set to list protection group backups");
        }

        final List<ProtectionGroup> groups = PaginatedFilterFetcher.fetchAll(backendApi.protectionGroups(),
                                                                              FilterExpression.eq("name", spec.protectionGroupName));
        if (groups.isEmpty()) {
            logger.info("No protection group of name {} found", spec.protectionGroupName);
            return ImmutableList.of();
        }

        final ProtectionGroup group = groups.get(0);

        final List<ProtectionGroupS3Asset> assets = PaginatedFilterFetcher.fetchAll(backendApi.protectionGroupS3Assets(),
                                                                                     FilterExpression.eq(PROTECTION_GROUP_ID, group.getId()));
        if (assets.isEmpty()) {
            logger.info("Protection group {} has no S3 assets", group.getName());
            return ImmutableList.of();
        }

        final List<String> assetIds = selectAssets(assets, spec.bucketNames);

        final TimeWindow window = timeWindowFilterBuilder.build(spec.searchWindow());
        final FilterExpression filter = window.getFilter().and(FilterExpression.eq(PROTECTION_GROUP_ID, group.getId()));

        final List<ProtectionGroupBackup> backups = PaginatedFilterFetcher.fetchAll(backendApi.protectionGroupBackups(), filter, window.getSort());

        final List<ProtectionGroupBackupRecord> records = AbstractBackupLister.latestPerAsset(
            backups.stream().map(backup -> new ProtectionGroupBackupRecord(backup.getId(),
                                                                           group.getId(),
                                                                           null,
                                                                           spec.sourceAccount,
                                                                           spec.sourceRegion,
                                                                           backup.getExpirationTimestamp(),
                                                                           group.getId(),
                                                                           group.getName(),
                                                                           assetIds,
                                                                           spec.objectFilters)).collect(toList()));

        logger.info("Discovered {} backups of protection group {} restoring {} assets, {} selected",
                    backups.size(), group.getName(), assetIds.size(), records.size());

        return records;
    }

    /**
     * @return ids of assets of the requested buckets, all assets when no bucket is requested
     * @throws NotFoundException when any requested bucket is not protected by the group
     */
    static List<String> selectAssets(final List<ProtectionGroupS3Asset> assets, final List<String> bucketNames) {
        if (bucketNames == null || bucketNames.isEmpty()) {
            return assets.stream().map(ProtectionGroupS3Asset::getId).collect(toList());
        }

        final List<String> selected = new ArrayList<>();
        final Set<String> missing = new TreeSet<>(bucketNames);

        for (final ProtectionGroupS3Asset asset : assets) {
            if (bucketNames.contains(asset.getBucketName())) {
                selected.add(asset.getId());
                missing.remove(asset.getBucketName());
            }
        }

        if (!missing.isEmpty()) {
            throw new NotFoundException(format("Buckets %s are not protected by the protection group", missing));
        }

        return selected;
    }
}
