package com.instaclustr.bulkrestore.impl.record;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

public final class Ec2BackupRecord extends BackupRecord {

    private final String sourceAmiId;
    private final String sourceIamInstanceProfileName;
    private final String sourceKeyPairName;
    private final String sourceVpcId;
    private final String sourceAz;
    private final List<EbsStorage> sourceEbsStorageList;
    private final List<NetworkInterface> sourceNetworkInterfaceList;

    @JsonCreator
    public Ec2BackupRecord(@JsonProperty("source_backup_id") final String sourceBackupId,
                           @JsonProperty("source_asset_id") final String sourceInstanceId,
                           @JsonProperty("source_tags") final List<Tag> sourceTags,
                           @JsonProperty("source_account") final String sourceAccount,
                           @JsonProperty("source_region") final String sourceRegion,
                           @JsonProperty("source_expire_time") final String sourceExpireTime,
                           @JsonProperty("source_ami_id") final String sourceAmiId,
                           @JsonProperty("source_iam_instance_profile_name") final String sourceIamInstanceProfileName,
                           @JsonProperty("source_key_pair_name") final String sourceKeyPairName,
                           @JsonProperty("source_vpc_id") final String sourceVpcId,
                           @JsonProperty("source_az") final String sourceAz,
                           @JsonProperty("source_ebs_storage_list") final List<EbsStorage> sourceEbsStorageList,
                           @JsonProperty("source_network_interface_list") final List<NetworkInterface> sourceNetworkInterfaceList) {
        super(sourceBackupId, sourceInstanceId, sourceTags, sourceAccount, sourceRegion, sourceExpireTime);
        this.sourceAmiId = sourceAmiId;
        this.sourceIamInstanceProfileName = sourceIamInstanceProfileName;
        this.sourceKeyPairName = sourceKeyPairName;
        this.sourceVpcId = sourceVpcId;
        this.sourceAz = sourceAz;
        this.sourceEbsStorageList = sourceEbsStorageList == null ? ImmutableList.of() : ImmutableList.copyOf(sourceEbsStorageList);
        this.sourceNetworkInterfaceList = sourceNetworkInterfaceList == null ? ImmutableList.of() : ImmutableList.copyOf(sourceNetworkInterfaceList);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.COMPUTE_INSTANCE;
    }

    @JsonProperty("source_ami_id")
    public String getSourceAmiId() {
        return sourceAmiId;
    }

    @JsonProperty("source_iam_instance_profile_name")
    public String getSourceIamInstanceProfileName() {
        return sourceIamInstanceProfileName;
    }

    @JsonProperty("source_key_pair_name")
    public String getSourceKeyPairName() {
        return sourceKeyPairName;
    }

    @JsonProperty("source_vpc_id")
    public String getSourceVpcId() {
        return sourceVpcId;
    }

    @JsonProperty("source_az")
    public String getSourceAz() {
        return sourceAz;
    }

    @JsonProperty("source_ebs_storage_list")
    public List<EbsStorage> getSourceEbsStorageList() {
        return sourceEbsStorageList;
    }

    @JsonProperty("source_network_interface_list")
    public List<NetworkInterface> getSourceNetworkInterfaceList() {
        return sourceNetworkInterfaceList;
    }

    /**
     * @return subnet of the first network interface, null when the instance had none
     */
    public String getFirstSubnetNativeId() {
        return sourceNetworkInterfaceList.isEmpty() ? null : sourceNetworkInterfaceList.get(0).getSubnetNativeId();
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("sourceAmiId", sourceAmiId)
            .add("sourceIamInstanceProfileName", sourceIamInstanceProfileName)
            .add("sourceKeyPairName", sourceKeyPairName)
            .add("sourceVpcId", sourceVpcId)
            .add("sourceAz", sourceAz)
            .add("sourceEbsStorageList", sourceEbsStorageList)
            .add("sourceNetworkInterfaceList", sourceNetworkInterfaceList)
            .toString();
    }

    /**
     * Storage volume attached to the instance at backup time.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EbsStorage {

        private final String name;
        private final String volumeNativeId;
        private final String kmsKeyNativeId;
        private final String type;
        private final List<Tag> tags;

        @JsonCreator
        public EbsStorage(@JsonProperty("name") final String name,
                          @JsonProperty("volume_native_id") final String volumeNativeId,
                          @JsonProperty("kms_key_native_id") final String kmsKeyNativeId,
                          @JsonProperty("type") final String type,
                          @JsonProperty("tags") final List<Tag> tags) {
            this.name = name;
            this.volumeNativeId = volumeNativeId;
            this.kmsKeyNativeId = kmsKeyNativeId;
            this.type = type;
            this.tags = tags == null ? ImmutableList.of() : ImmutableList.copyOf(tags);
        }

        @JsonProperty("name")
        public String getName() {
            return name;
        }

        @JsonProperty("volume_native_id")
        public String getVolumeNativeId() {
            return volumeNativeId;
        }

        @JsonProperty("kms_key_native_id")
        public String getKmsKeyNativeId() {
            return kmsKeyNativeId;
        }

        @JsonProperty("type")
        public String getType() {
            return type;
        }

        @JsonProperty("tags")
        public List<Tag> getTags() {
            return tags;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("volumeNativeId", volumeNativeId)
                .add("kmsKeyNativeId", kmsKeyNativeId)
                .add("type", type)
                .add("tags", tags)
                .toString();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NetworkInterface {

        private final Integer deviceIndex;
        private final String networkInterfaceNativeId;
        private final String subnetNativeId;
        private final List<String> securityGroupNativeIds;

        @JsonCreator
        public NetworkInterface(@JsonProperty("device_index") final Integer deviceIndex,
                                @JsonProperty("network_interface_native_id") final String networkInterfaceNativeId,
                                @JsonProperty("subnet_native_id") final String subnetNativeId,
                                @JsonProperty("security_group_native_ids") final List<String> securityGroupNativeIds) {
            this.deviceIndex = deviceIndex;
            this.networkInterfaceNativeId = networkInterfaceNativeId;
            this.subnetNativeId = subnetNativeId;
            this.securityGroupNativeIds = securityGroupNativeIds == null ? ImmutableList.of() : ImmutableList.copyOf(securityGroupNativeIds);
        }

        @JsonProperty("device_index")
        public Integer getDeviceIndex() {
            return deviceIndex;
        }

        @JsonProperty("network_interface_native_id")
        public String getNetworkInterfaceNativeId() {
            return networkInterfaceNativeId;
        }

        @JsonProperty("subnet_native_id")
        public String getSubnetNativeId() {
            return subnetNativeId;
        }

        @JsonProperty("security_group_native_ids")
        public List<String> getSecurityGroupNativeIds() {
            return securityGroupNativeIds;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("deviceIndex", deviceIndex)
                .add("networkInterfaceNativeId", networkInterfaceNativeId)
                .add("subnetNativeId", subnetNativeId)
                .add("securityGroupNativeIds", securityGroupNativeIds)
                .toString();
        }
    }
}
