package com.instaclustr.bulkrestore.impl.restore;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.NotFoundException;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.backend.S3Bucket;
import com.instaclustr.bulkrestore.impl.filter.FilterExpression;
import com.instaclustr.bulkrestore.impl.list.PaginatedFilterFetcher;
import com.instaclustr.bulkrestore.impl.record.ProtectionGroupBackupRecord;
import com.instaclustr.bulkrestore.impl.retry.Retrier;
import com.instaclustr.bulkrestore.impl.retry.RetrierFactory;
import com.instaclustr.bulkrestore.impl.retry.RetrySpec;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_ACCOUNT;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_BUCKET;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_PREFIX;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_REGION;
import static java.lang.String.format;

/**
 * The target bucket is looked up by name in the target account and region, its environment becomes the
 * environment of the restore.
 */
public class ProtectionGroupRestoreRequestBuilder extends AbstractRestoreRequestBuilder<ProtectionGroupBackupRecord, ProtectionGroupRestoreRequest> {

    private static final Logger logger = LoggerFactory.getLogger(ProtectionGroupRestoreRequestBuilder.class);

    private final BackendApi backendApi;
    private final Retrier retrier;

    @Inject
    public ProtectionGroupRestoreRequestBuilder(final BackendApi backendApi, final RetrySpec retrySpec) {
        super(ProtectionGroupBackupRecord.class);
        this.backendApi = backendApi;
        this.retrier = RetrierFactory.getRetrier(retrySpec);
    }

    @Override
    public boolean requiresEnvironment() {
        return false;
    }

    @Override
    protected ProtectionGroupRestoreRequest build0(final ProtectionGroupBackupRecord record, final TargetSpec spec, final String environmentId) {
        final S3Bucket bucket = findBucket(spec.getString(TARGET_ACCOUNT), spec.getString(TARGET_REGION), spec.getString(TARGET_BUCKET));

        return new ProtectionGroupRestoreRequest(record.getSourceBackupId(),
                                                 record.getProtectionGroupS3AssetIds(),
                                                 record.getObjectFilters(),
                                                 bucket.getId(),
                                                 bucket.getEnvironmentId(),
                                                 spec.getString(TARGET_PREFIX));
    }

    S3Bucket findBucket(final String account, final String region, final String name) {
        final FilterExpression filter = FilterExpression.builder()
            .eq("account_native_id", account)
            .eq("aws_region", region)
            .in("name", ImmutableList.of(name))
            .build();

        final List<S3Bucket> buckets;

        try {
            buckets = retrier.submit(() -> PaginatedFilterFetcher.fetchAll(backendApi.s3Buckets(), filter));
        } catch (final RuntimeException ex) {
            throw ex;
        } catch (final Exception ex) {
            throw new IllegalStateException(format("Unable to list buckets with filter %s", filter), ex);
        }

        final S3Bucket bucket = buckets.stream()
            .filter(b -> name.equals(b.getName()))
            .findFirst()
            .orElseThrow(() -> new NotFoundException(format("No target bucket %s found in account %s and region %s", name, account, region)));

        logger.debug("Resolved target bucket {} to {}", name, bucket);

        return bucket;
    }
}
