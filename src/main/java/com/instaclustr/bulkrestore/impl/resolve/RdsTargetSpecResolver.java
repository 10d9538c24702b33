package com.instaclustr.bulkrestore.impl.resolve;

import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.record.RdsBackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.google.common.base.Strings.isNullOrEmpty;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_INSTANCE_CLASS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KMS_KEY_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_RDS_NAME;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_SECURITY_GROUP_NATIVE_IDS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_SUBNET_GROUP_NAME;

/**
 * A database restored into its own account without a name gets the source resource id followed by a random
 * suffix, so it never collides with the source database.
 */
public class RdsTargetSpecResolver extends AbstractTargetSpecResolver<RdsBackupRecord> {

    private final NameGenerator nameGenerator;

    @Inject
    public RdsTargetSpecResolver(final NameGenerator nameGenerator) {
        super(RdsBackupRecord.class);
        this.nameGenerator = nameGenerator;
    }

    @Override
    protected TargetSpec resolveFields(final TargetSpec spec, final RdsBackupRecord record, final boolean crossAccount) {
        TargetSpec resolved = inherit(spec, TARGET_SUBNET_GROUP_NAME, record.getSourceSubnetGroupName(), crossAccount, true);
        resolved = inherit(resolved, TARGET_SECURITY_GROUP_NATIVE_IDS, record.getSourceSecurityGroupNativeIds(), crossAccount, true);
        resolved = inherit(resolved, TARGET_KMS_KEY_NATIVE_ID, record.getSourceKms(), crossAccount, true);

        final String firstInstanceClass = record.getSourceInstances().isEmpty() ? null : record.getSourceInstances().get(0).getInstanceClass();
        resolved = inherit(resolved, TARGET_INSTANCE_CLASS, firstInstanceClass, crossAccount, false);

        if (resolved.isBlank(TARGET_RDS_NAME)) {
            if (crossAccount) {
                throw crossAccountFailure(TARGET_RDS_NAME);
            }
            if (isNullOrEmpty(record.getSourceAssetId())) {
                throw new ValidationException(TARGET_RDS_NAME.getJsonName(), "target_rds_name has to be set when the backup has no source resource id");
            }
            resolved = resolved.with(TARGET_RDS_NAME, record.getSourceAssetId() + "-" + nameGenerator.nameSuffix());
        }

        return resolved;
    }
}
