package com.instaclustr.bulkrestore.impl.record;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

import static java.util.Collections.unmodifiableMap;

public final class ProtectionGroupBackupRecord extends BackupRecord {

    public static final String LATEST_VERSION_ONLY = "latest_version_only";

    private final String protectionGroupId;
    private final String protectionGroupName;
    private final List<String> protectionGroupS3AssetIds;
    private final Map<String, Object> objectFilters;

    @JsonCreator
    public ProtectionGroupBackupRecord(@JsonProperty("source_backup_id") final String sourceBackupId,
                                       @JsonProperty("source_asset_id") final String sourceAssetId,
                                       @JsonProperty("source_tags") final List<Tag> sourceTags,
                                       @JsonProperty("source_account") final String sourceAccount,
                                       @JsonProperty("source_region") final String sourceRegion,
                                       @JsonProperty("source_expire_time") final String sourceExpireTime,
                                       @JsonProperty("protection_group_id") final String protectionGroupId,
                                       @JsonProperty("protection_group_name") final String protectionGroupName,
                                       @JsonProperty("protection_group_s3_asset_ids") final List<String> protectionGroupS3AssetIds,
                                       @JsonProperty("object_filters") final Map<String, Object> objectFilters) {
        super(sourceBackupId, sourceAssetId == null ? protectionGroupId : sourceAssetId, sourceTags, sourceAccount, sourceRegion, sourceExpireTime);
        this.protectionGroupId = protectionGroupId;
        this.protectionGroupName = protectionGroupName;
        this.protectionGroupS3AssetIds = protectionGroupS3AssetIds == null ? ImmutableList.of() : ImmutableList.copyOf(protectionGroupS3AssetIds);
        this.objectFilters = withDefaultFilters(objectFilters);
    }

    private static Map<String, Object> withDefaultFilters(final Map<String, Object> objectFilters) {
        final Map<String, Object> filters = new LinkedHashMap<>();
        if (objectFilters != null) {
            filters.putAll(objectFilters);
        }
        filters.putIfAbsent(LATEST_VERSION_ONLY, Boolean.TRUE);
        return unmodifiableMap(filters);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.OBJECT_PROTECTION_GROUP;
    }

    @JsonProperty("protection_group_id")
    public String getProtectionGroupId() {
        return protectionGroupId;
    }

    @JsonProperty("protection_group_name")
    public String getProtectionGroupName() {
        return protectionGroupName;
    }

    @JsonProperty("protection_group_s3_asset_ids")
    public List<String> getProtectionGroupS3AssetIds() {
        return protectionGroupS3AssetIds;
    }

    @JsonProperty("object_filters")
    public Map<String, Object> getObjectFilters() {
        return objectFilters;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("protectionGroupId", protectionGroupId)
            .add("protectionGroupName", protectionGroupName)
            .add("protectionGroupS3AssetIds", protectionGroupS3AssetIds)
            .add("objectFilters", objectFilters)
            .toString();
    }
}
