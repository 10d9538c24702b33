package com.instaclustr.bulkrestore.impl.record;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.google.common.base.MoreObjects;
import com.google.common.base.MoreObjects.ToStringHelper;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;
import com.instaclustr.bulkrestore.impl.ValidationException;

import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * Snapshot of a protected resource at backup time, as returned by discovery. Records are immutable, target
 * resolution and request building only read them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "resource_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EbsBackupRecord.class, name = "EBS"),
    @JsonSubTypes.Type(value = Ec2BackupRecord.class, name = "EC2"),
    @JsonSubTypes.Type(value = RdsBackupRecord.class, name = "RDS"),
    @JsonSubTypes.Type(value = DynamoDbBackupRecord.class, name = "DynamoDB"),
    @JsonSubTypes.Type(value = ProtectionGroupBackupRecord.class, name = "ProtectionGroup")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class BackupRecord {

    private final String sourceBackupId;
    private final String sourceAssetId;
    private final List<Tag> sourceTags;
    private final String sourceAccount;
    private final String sourceRegion;
    private final String sourceExpireTime;

    protected BackupRecord(final String sourceBackupId,
                           final String sourceAssetId,
                           final List<Tag> sourceTags,
                           final String sourceAccount,
                           final String sourceRegion,
                           final String sourceExpireTime) {
        if (isNullOrEmpty(sourceBackupId)) {
            throw new ValidationException("source_backup_id", "Backup record has to have source_backup_id.");
        }
        this.sourceBackupId = sourceBackupId;
        this.sourceAssetId = sourceAssetId;
        this.sourceTags = sourceTags == null ? ImmutableList.of() : ImmutableList.copyOf(sourceTags);
        this.sourceAccount = sourceAccount;
        this.sourceRegion = sourceRegion;
        this.sourceExpireTime = sourceExpireTime;
    }

    @JsonProperty("resource_type")
    public abstract ResourceType getResourceType();

    @JsonProperty("source_backup_id")
    public String getSourceBackupId() {
        return sourceBackupId;
    }

    @JsonProperty("source_asset_id")
    public String getSourceAssetId() {
        return sourceAssetId;
    }

    @JsonProperty("source_tags")
    public List<Tag> getSourceTags() {
        return sourceTags;
    }

    @JsonProperty("source_account")
    public String getSourceAccount() {
        return sourceAccount;
    }

    @JsonProperty("source_region")
    public String getSourceRegion() {
        return sourceRegion;
    }

    @JsonProperty("source_expire_time")
    public String getSourceExpireTime() {
        return sourceExpireTime;
    }

    protected ToStringHelper toStringHelper() {
        return MoreObjects.toStringHelper(this)
            .add("sourceBackupId", sourceBackupId)
            .add("sourceAssetId", sourceAssetId)
            .add("sourceTags", sourceTags)
            .add("sourceAccount", sourceAccount)
            .add("sourceRegion", sourceRegion)
            .add("sourceExpireTime", sourceExpireTime);
    }

    @Override
    public String toString() {
        return toStringHelper().toString();
    }
}
