package com.instaclustr.bulkrestore.impl.restore;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

public final class EbsRestoreRequest extends RestoreRequest {

    private final String az;
    private final Integer iops;
    private final String kmsKeyNativeId;
    private final String volumeType;

    public EbsRestoreRequest(final String sourceBackupId,
                             final String environmentId,
                             final String az,
                             final Integer iops,
                             final String kmsKeyNativeId,
                             final String volumeType,
                             final List<Tag> tags) {
        super(sourceBackupId, environmentId, tags);
        this.az = az;
        this.iops = iops;
        this.kmsKeyNativeId = kmsKeyNativeId;
        this.volumeType = volumeType;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.BLOCK_VOLUME;
    }

    @JsonProperty("aws_az")
    public String getAz() {
        return az;
    }

    /**
     * @return provisioned IOPS, null when the volume is restored without them
     */
    @JsonProperty("iops")
    public Integer getIops() {
        return iops;
    }

    @JsonProperty("kms_key_native_id")
    public String getKmsKeyNativeId() {
        return kmsKeyNativeId;
    }

    @JsonProperty("type")
    public String getVolumeType() {
        return volumeType;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("az", az)
            .add("iops", iops)
            .add("kmsKeyNativeId", kmsKeyNativeId)
            .add("volumeType", volumeType)
            .toString();
    }
}
