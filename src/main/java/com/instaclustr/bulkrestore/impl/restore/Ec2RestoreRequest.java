package com.instaclustr.bulkrestore.impl.restore;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

public final class Ec2RestoreRequest extends RestoreRequest {

    private final String az;
    private final String vpcNativeId;
    private final String subnetNativeId;
    private final String keyPairName;
    private final String iamInstanceProfileName;
    private final List<BlockDeviceMapping> ebsBlockDeviceMappings;
    private final List<NetworkInterfaceMapping> networkInterfaces;
    private final boolean shouldPowerOn;

    public Ec2RestoreRequest(final String sourceBackupId,
                             final String environmentId,
                             final String az,
                             final String vpcNativeId,
                             final String subnetNativeId,
                             final String keyPairName,
                             final String iamInstanceProfileName,
                             final List<BlockDeviceMapping> ebsBlockDeviceMappings,
                             final List<NetworkInterfaceMapping> networkInterfaces,
                             final List<Tag> tags,
                             final boolean shouldPowerOn) {
        super(sourceBackupId, environmentId, tags);
        this.az = az;
        this.vpcNativeId = vpcNativeId;
        this.subnetNativeId = subnetNativeId;
        this.keyPairName = keyPairName;
        this.iamInstanceProfileName = iamInstanceProfileName;
        this.ebsBlockDeviceMappings = ImmutableList.copyOf(ebsBlockDeviceMappings);
        this.networkInterfaces = ImmutableList.copyOf(networkInterfaces);
        this.shouldPowerOn = shouldPowerOn;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.COMPUTE_INSTANCE;
    }

    @JsonProperty("aws_az")
    public String getAz() {
        return az;
    }

    @JsonProperty("vpc_native_id")
    public String getVpcNativeId() {
        return vpcNativeId;
    }

    @JsonProperty("subnet_native_id")
    public String getSubnetNativeId() {
        return subnetNativeId;
    }

    @JsonProperty("key_pair_name")
    public String getKeyPairName() {
        return keyPairName;
    }

    @JsonProperty("iam_instance_profile_name")
    public String getIamInstanceProfileName() {
        return iamInstanceProfileName;
    }

    @JsonProperty("ebs_block_device_mappings")
    public List<BlockDeviceMapping> getEbsBlockDeviceMappings() {
        return ebsBlockDeviceMappings;
    }

    @JsonProperty("network_interfaces")
    public List<NetworkInterfaceMapping> getNetworkInterfaces() {
        return networkInterfaces;
    }

    @JsonProperty("should_power_on")
    public boolean isShouldPowerOn() {
        return shouldPowerOn;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("az", az)
            .add("vpcNativeId", vpcNativeId)
            .add("subnetNativeId", subnetNativeId)
            .add("keyPairName", keyPairName)
            .add("iamInstanceProfileName", iamInstanceProfileName)
            .add("ebsBlockDeviceMappings", ebsBlockDeviceMappings)
            .add("networkInterfaces", networkInterfaces)
            .add("shouldPowerOn", shouldPowerOn)
            .toString();
    }

    public static final class BlockDeviceMapping {

        private final String name;
        private final String volumeNativeId;
        private final String kmsKeyNativeId;
        private final List<Tag> tags;

        public BlockDeviceMapping(final String name, final String volumeNativeId, final String kmsKeyNativeId, final List<Tag> tags) {
            this.name = name;
            this.volumeNativeId = volumeNativeId;
            this.kmsKeyNativeId = kmsKeyNativeId;
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
                .add("tags", tags)
                .toString();
        }
    }

    /**
     * Interfaces are created new in the target subnet, the backed up interface is not reused.
     */
    public static final class NetworkInterfaceMapping {

        private final Integer deviceIndex;
        private final String subnetNativeId;
        private final List<String> securityGroupNativeIds;

        public NetworkInterfaceMapping(final Integer deviceIndex, final String subnetNativeId, final List<String> securityGroupNativeIds) {
            this.deviceIndex = deviceIndex;
            this.subnetNativeId = subnetNativeId;
            this.securityGroupNativeIds = securityGroupNativeIds == null ? ImmutableList.of() : ImmutableList.copyOf(securityGroupNativeIds);
        }

        @JsonProperty("device_index")
        public Integer getDeviceIndex() {
            return deviceIndex;
        }

        @JsonProperty("subnet_native_id")
        public String getSubnetNativeId() {
            return subnetNativeId;
        }

        @JsonProperty("security_group_native_ids")
        public List<String> getSecurityGroupNativeIds() {
            return securityGroupNativeIds;
        }

        @JsonProperty("restore_default")
        public boolean isRestoreDefault() {
            return true;
        }

        @JsonProperty("restore_from_backup")
        public boolean isRestoreFromBackup() {
            return false;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("deviceIndex", deviceIndex)
                .add("subnetNativeId", subnetNativeId)
                .add("securityGroupNativeIds", securityGroupNativeIds)
                .toString();
        }
    }
}
