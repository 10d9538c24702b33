package com.instaclustr.bulkrestore.impl.restore;

import com.instaclustr.bulkrestore.impl.record.EbsBackupRecord;
import com.instaclustr.bulkrestore.impl.resolve.EbsTargetSpecResolver;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_AZ;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_IOPS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KMS_KEY_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_VOLUME_TYPE;

public class EbsRestoreRequestBuilder extends AbstractRestoreRequestBuilder<EbsBackupRecord, EbsRestoreRequest> {

    public EbsRestoreRequestBuilder() {
        super(EbsBackupRecord.class);
    }

    @Override
    protected EbsRestoreRequest build0(final EbsBackupRecord record, final TargetSpec spec, final String environmentId) {
        EbsTargetSpecResolver.checkIops(spec);

        final Integer iops = spec.getInteger(TARGET_IOPS);

        return new EbsRestoreRequest(record.getSourceBackupId(),
                                     environmentId,
                                     spec.getString(TARGET_AZ),
                                     iops == null || iops == 0 ? null : iops,
                                     spec.getString(TARGET_KMS_KEY_NATIVE_ID),
                                     spec.getString(TARGET_VOLUME_TYPE),
                                     spec.getTags());
    }
}
