package com.instaclustr.bulkrestore.impl.list;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.TooManyResultsException;
import com.instaclustr.bulkrestore.impl.backend.ListingEndpoint;
import com.instaclustr.bulkrestore.impl.filter.FilterExpression;
import com.instaclustr.bulkrestore.impl.filter.TagMatcher;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder.TimeWindow;
import com.instaclustr.bulkrestore.impl.record.BackupRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.stream.Collectors.toList;

/**
 * Lists backups of a backup listing endpoint: the time window and the asset id are sent to the backend,
 * account, region and tag are matched locally.
 *
 * @param <R> record of the listed resource type
 */
public abstract class AbstractBackupLister<R extends BackupRecord> implements BackupLister {

    private static final Logger logger = LoggerFactory.getLogger(AbstractBackupLister.class);

    protected final TimeWindowFilterBuilder timeWindowFilterBuilder;

    protected AbstractBackupLister(final TimeWindowFilterBuilder timeWindowFilterBuilder) {
        this.timeWindowFilterBuilder = timeWindowFilterBuilder;
    }

    protected abstract ResourceType resourceType();

    protected abstract ListingEndpoint<R> endpoint();

    /**
     * @return backend field holding the id of the backed up asset
     */
    protected abstract String assetIdField();

    @Override
    public List<R> list(final DiscoverySpec spec) {
        spec.validate();

        final TimeWindow window = timeWindowFilterBuilder.build(spec.searchWindow());

        FilterExpression filter = window.getFilter();

        if (!isNullOrEmpty(spec.searchAssetId)) {
            filter = filter.and(FilterExpression.eq(assetIdField(), spec.searchAssetId));
        }

        final List<R> fetched = PaginatedFilterFetcher.fetchAll(endpoint(), filter, window.getSort());

        final List<R> inSource = fetched.stream()
            .filter(record -> Objects.equals(record.getSourceAccount(), spec.sourceAccount)
                && Objects.equals(record.getSourceRegion(), spec.sourceRegion))
            .collect(toList());

        List<R> records = TagMatcher.filter(inSource, spec.searchTagKey, spec.searchTagValue);

        if (spec.latestOnly) {
            records = latestPerAsset(records);
        }

        logger.info("Discovered {} {} backups in {}/{}, {} after account and region match, {} selected",
                    fetched.size(),
                    resourceType(),
                    spec.sourceAccount,
                    spec.sourceRegion,
                    inSource.size(),
                    records.size());

        if (records.size() > spec.maxResults) {
            throw new TooManyResultsException(records.size(), spec.maxResults);
        }

        return records;
    }

    /**
     * Keeps the first record of every asset. The time window sort decides which one that is.
     */
    static <R extends BackupRecord> List<R> latestPerAsset(final List<R> records) {
        final Set<String> seen = new HashSet<>();
        final List<R> latest = new ArrayList<>();

        for (final R record : records) {
            if (seen.add(record.getSourceAssetId())) {
                latest.add(record);
            }
        }

        return latest;
    }
}
