package com.instaclustr.bulkrestore.impl.record;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

public final class EbsBackupRecord extends BackupRecord {

    private final Boolean encrypted;
    private final String sourceAz;
    private final String sourceKms;
    private final String sourceVolumeType;
    private final Integer sourceIops;

    @JsonCreator
    public EbsBackupRecord(@JsonProperty("source_backup_id") final String sourceBackupId,
                           @JsonProperty("source_asset_id") final String sourceVolumeId,
                           @JsonProperty("source_tags") final List<Tag> sourceTags,
                           @JsonProperty("source_account") final String sourceAccount,
                           @JsonProperty("source_region") final String sourceRegion,
                           @JsonProperty("source_expire_time") final String sourceExpireTime,
                           @JsonProperty("source_encrypted_flag") final Boolean encrypted,
                           @JsonProperty("source_az") final String sourceAz,
                           @JsonProperty("source_kms") final String sourceKms,
                           @JsonProperty("source_volume_type") final String sourceVolumeType,
                           @JsonProperty("source_iops") final Integer sourceIops) {
        super(sourceBackupId, sourceVolumeId, sourceTags, sourceAccount, sourceRegion, sourceExpireTime);
        this.encrypted = encrypted;
        this.sourceAz = sourceAz;
        this.sourceKms = sourceKms;
        this.sourceVolumeType = sourceVolumeType;
        this.sourceIops = sourceIops;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.BLOCK_VOLUME;
    }

    @JsonProperty("source_encrypted_flag")
    public Boolean getEncrypted() {
        return encrypted;
    }

    @JsonProperty("source_az")
    public String getSourceAz() {
        return sourceAz;
    }

    @JsonProperty("source_kms")
    public String getSourceKms() {
        return sourceKms;
    }

    @JsonProperty("source_volume_type")
    public String getSourceVolumeType() {
        return sourceVolumeType;
    }

    @JsonProperty("source_iops")
    public Integer getSourceIops() {
        return sourceIops;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("encrypted", encrypted)
            .add("sourceAz", sourceAz)
            .add("sourceKms", sourceKms)
            .add("sourceVolumeType", sourceVolumeType)
            .add("sourceIops", sourceIops)
            .toString();
    }
}
