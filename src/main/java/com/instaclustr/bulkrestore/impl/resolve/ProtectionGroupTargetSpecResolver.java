package com.instaclustr.bulkrestore.impl.resolve;

import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.record.ProtectionGroupBackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_BUCKET;

public class ProtectionGroupTargetSpecResolver extends AbstractTargetSpecResolver<ProtectionGroupBackupRecord> {

    public ProtectionGroupTargetSpecResolver() {
        super(ProtectionGroupBackupRecord.class);
    }

    @Override
    protected TargetSpec resolveFields(final TargetSpec spec, final ProtectionGroupBackupRecord record, final boolean crossAccount) {
        if (spec.isBlank(TARGET_BUCKET)) {
            throw new ValidationException(TARGET_BUCKET.getJsonName(), "target_bucket has to be set to restore a protection group");
        }
        return spec;
    }
}
