package com.instaclustr.bulkrestore.impl.restore;

import java.util.ArrayList;
import java.util.List;

import com.instaclustr.bulkrestore.impl.record.Ec2BackupRecord;
import com.instaclustr.bulkrestore.impl.record.Ec2BackupRecord.EbsStorage;
import com.instaclustr.bulkrestore.impl.record.Ec2BackupRecord.NetworkInterface;
import com.instaclustr.bulkrestore.impl.restore.Ec2RestoreRequest.BlockDeviceMapping;
import com.instaclustr.bulkrestore.impl.restore.Ec2RestoreRequest.NetworkInterfaceMapping;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_AZ;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_IAM_INSTANCE_PROFILE_NAME;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KEY_PAIR_NAME;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KMS_KEY_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_SECURITY_GROUP_NATIVE_IDS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_SUBNET_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_VPC_NATIVE_ID;

/**
 * Volumes and network interfaces are mapped from the backup. A KMS key or security groups of the spec apply
 * to every volume or interface, otherwise each keeps its own. Without a subnet in the spec every interface
 * is placed in the subnet of the first backed up interface.
 */
public class Ec2RestoreRequestBuilder extends AbstractRestoreRequestBuilder<Ec2BackupRecord, Ec2RestoreRequest> {

    public Ec2RestoreRequestBuilder() {
        super(Ec2BackupRecord.class);
    }

    @Override
    protected Ec2RestoreRequest build0(final Ec2BackupRecord record, final TargetSpec spec, final String environmentId) {
        final String kmsKey = spec.isBlank(TARGET_KMS_KEY_NATIVE_ID) ? null : spec.getString(TARGET_KMS_KEY_NATIVE_ID);

        final List<BlockDeviceMapping> volumes = new ArrayList<>();

        for (final EbsStorage storage : record.getSourceEbsStorageList()) {
            volumes.add(new BlockDeviceMapping(storage.getName(),
                                               storage.getVolumeNativeId(),
                                               kmsKey != null ? kmsKey : storage.getKmsKeyNativeId(),
                                               storage.getTags()));
        }

        final List<String> securityGroups = spec.getStringList(TARGET_SECURITY_GROUP_NATIVE_IDS);
        final String subnet = spec.isBlank(TARGET_SUBNET_NATIVE_ID) ? record.getFirstSubnetNativeId() : spec.getString(TARGET_SUBNET_NATIVE_ID);

        final List<NetworkInterfaceMapping> interfaces = new ArrayList<>();

        for (final NetworkInterface networkInterface : record.getSourceNetworkInterfaceList()) {
            interfaces.add(new NetworkInterfaceMapping(networkInterface.getDeviceIndex(),
                                                       subnet,
                                                       securityGroups.isEmpty() ? networkInterface.getSecurityGroupNativeIds() : securityGroups));
        }

        return new Ec2RestoreRequest(record.getSourceBackupId(),
                                     environmentId,
                                     spec.getString(TARGET_AZ),
                                     orElse(spec.getString(TARGET_VPC_NATIVE_ID), record.getSourceVpcId()),
                                     subnet,
                                     orElse(spec.getString(TARGET_KEY_PAIR_NAME), record.getSourceKeyPairName()),
                                     spec.isBlank(TARGET_IAM_INSTANCE_PROFILE_NAME) ? null : spec.getString(TARGET_IAM_INSTANCE_PROFILE_NAME),
                                     volumes,
                                     interfaces,
                                     spec.getTags(),
                                     true);
    }

    private static String orElse(final String value, final String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value;
    }
}
