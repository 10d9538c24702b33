package com.instaclustr.bulkrestore.impl.resolve;

import com.instaclustr.bulkrestore.impl.record.Ec2BackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_AZ;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_IAM_INSTANCE_PROFILE_NAME;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KEY_PAIR_NAME;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KMS_KEY_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_SECURITY_GROUP_NATIVE_IDS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_SUBNET_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_VPC_NATIVE_ID;

/**
 * Security groups and KMS keys are never inherited as a whole, in the source account every network interface
 * and every volume keeps its own.
 */
public class Ec2TargetSpecResolver extends AbstractTargetSpecResolver<Ec2BackupRecord> {

    public Ec2TargetSpecResolver() {
        super(Ec2BackupRecord.class);
    }

    @Override
    protected TargetSpec resolveFields(final TargetSpec spec, final Ec2BackupRecord record, final boolean crossAccount) {
        TargetSpec resolved = inherit(spec, TARGET_AZ, record.getSourceAz(), crossAccount, false);
        resolved = inherit(resolved, TARGET_VPC_NATIVE_ID, record.getSourceVpcId(), crossAccount, true);
        resolved = inherit(resolved, TARGET_SUBNET_NATIVE_ID, record.getFirstSubnetNativeId(), crossAccount, true);
        resolved = inherit(resolved, TARGET_SECURITY_GROUP_NATIVE_IDS, null, crossAccount, true);
        resolved = inherit(resolved, TARGET_KMS_KEY_NATIVE_ID, null, crossAccount, true);
        resolved = inherit(resolved, TARGET_KEY_PAIR_NAME, record.getSourceKeyPairName(), crossAccount, false);
        return inherit(resolved, TARGET_IAM_INSTANCE_PROFILE_NAME, record.getSourceIamInstanceProfileName(), crossAccount, false);
    }
}
