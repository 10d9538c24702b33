package com.instaclustr.bulkrestore.impl.restore;

import com.instaclustr.bulkrestore.impl.record.RdsBackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_INSTANCE_CLASS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KMS_KEY_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_RDS_NAME;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_SECURITY_GROUP_NATIVE_IDS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_SUBNET_GROUP_NAME;

public class RdsRestoreRequestBuilder extends AbstractRestoreRequestBuilder<RdsBackupRecord, RdsRestoreRequest> {

    public RdsRestoreRequestBuilder() {
        super(RdsBackupRecord.class);
    }

    @Override
    protected RdsRestoreRequest build0(final RdsBackupRecord record, final TargetSpec spec, final String environmentId) {
        return new RdsRestoreRequest(record.getSourceBackupId(),
                                     environmentId,
                                     spec.getString(TARGET_RDS_NAME),
                                     spec.getString(TARGET_INSTANCE_CLASS),
                                     spec.getString(TARGET_KMS_KEY_NATIVE_ID),
                                     spec.getStringList(TARGET_SECURITY_GROUP_NATIVE_IDS),
                                     spec.getString(TARGET_SUBNET_GROUP_NAME),
                                     publiclyAccessible(record),
                                     spec.getTags());
    }

    /**
     * @return true only when every instance of the backup was publicly accessible
     */
    static boolean publiclyAccessible(final RdsBackupRecord record) {
        return !record.getSourceInstances().isEmpty()
            && record.getSourceInstances().stream().allMatch(RdsBackupRecord.Instance::isPubliclyAccessible);
    }
}
