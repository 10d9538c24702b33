package com.instaclustr.bulkrestore.impl.restore;

import com.instaclustr.bulkrestore.impl.record.DynamoDbBackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_TABLE_NAME;

public class DynamoDbRestoreRequestBuilder extends AbstractRestoreRequestBuilder<DynamoDbBackupRecord, DynamoDbRestoreRequest> {

    public DynamoDbRestoreRequestBuilder() {
        super(DynamoDbBackupRecord.class);
    }

    @Override
    protected DynamoDbRestoreRequest build0(final DynamoDbBackupRecord record, final TargetSpec spec, final String environmentId) {
        return new DynamoDbRestoreRequest(record.getSourceBackupId(),
                                          environmentId,
                                          spec.getString(TARGET_TABLE_NAME),
                                          record.getSourceSseSpecification(),
                                          record.getSourceProvisionedThroughput(),
                                          record.getSourceBillingMode(),
                                          record.getSourceTableClass(),
                                          record.getSourceGlobalSecondaryIndexes(),
                                          record.getSourceLocalSecondaryIndexes(),
                                          spec.getTags());
    }
}
