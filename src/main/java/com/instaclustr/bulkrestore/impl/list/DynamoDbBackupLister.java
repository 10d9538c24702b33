package com.instaclustr.bulkrestore.impl.list;

import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.backend.ListingEndpoint;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder;
import com.instaclustr.bulkrestore.impl.record.DynamoDbBackupRecord;

public class DynamoDbBackupLister extends AbstractBackupLister<DynamoDbBackupRecord> {

    private final BackendApi backendApi;

    @Inject
    public DynamoDbBackupLister(final BackendApi backendApi, final TimeWindowFilterBuilder timeWindowFilterBuilder) {
        super(timeWindowFilterBuilder);
        this.backendApi = backendApi;
    }

    @Override
    protected ResourceType resourceType() {
        return ResourceType.KEY_VALUE_TABLE;
    }

    @Override
    protected ListingEndpoint<DynamoDbBackupRecord> endpoint() {
        return backendApi.dynamoDbBackups();
    }

    @Override
    protected String assetIdField() {
        return "table_id";
    }
}
