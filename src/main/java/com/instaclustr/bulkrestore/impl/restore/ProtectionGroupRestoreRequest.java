package com.instaclustr.bulkrestore.impl.restore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;

import static java.util.Collections.unmodifiableMap;

/**
 * Restores objects of the selected buckets of a protection group backup into one bucket. Existing objects
 * are overwritten and keep the storage class they had at backup time.
 */
public final class ProtectionGroupRestoreRequest extends RestoreRequest {

    private final List<String> protectionGroupS3AssetIds;
    private final Map<String, Object> objectFilters;
    private final String bucketId;
    private final String prefix;

    public ProtectionGroupRestoreRequest(final String sourceBackupId,
                                         final List<String> protectionGroupS3AssetIds,
                                         final Map<String, Object> objectFilters,
                                         final String bucketId,
                                         final String environmentId,
                                         final String prefix) {
        super(sourceBackupId, environmentId, ImmutableList.of());
        this.protectionGroupS3AssetIds = ImmutableList.copyOf(protectionGroupS3AssetIds);
        this.objectFilters = unmodifiableMap(new LinkedHashMap<>(objectFilters));
        this.bucketId = bucketId;
        this.prefix = prefix;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.OBJECT_PROTECTION_GROUP;
    }

    @JsonProperty("protection_group_s3_asset_ids")
    public List<String> getProtectionGroupS3AssetIds() {
        return protectionGroupS3AssetIds;
    }

    @JsonProperty("object_filters")
    public Map<String, Object> getObjectFilters() {
        return objectFilters;
    }

    @JsonProperty("bucket_id")
    public String getBucketId() {
        return bucketId;
    }

    @JsonProperty("prefix")
    public String getPrefix() {
        return prefix;
    }

    @JsonProperty("overwrite")
    public boolean isOverwrite() {
        return true;
    }

    @JsonProperty("restore_original_storage_class")
    public boolean isRestoreOriginalStorageClass() {
        return true;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("protectionGroupS3AssetIds", protectionGroupS3AssetIds)
            .add("objectFilters", objectFilters)
            .add("bucketId", bucketId)
            .add("prefix", prefix)
            .toString();
    }
}
