package com.instaclustr.bulkrestore.impl.list;

import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.backend.ListingEndpoint;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder;
import com.instaclustr.bulkrestore.impl.record.RdsBackupRecord;

public class RdsBackupLister extends AbstractBackupLister<RdsBackupRecord> {

    private final BackendApi backendApi;

    @Inject
    public RdsBackupLister(final BackendApi backendApi, final TimeWindowFilterBuilder timeWindowFilterBuilder) {
        super(timeWindowFilterBuilder);
        this.backendApi = backendApi;
    }

    @Override
    protected ResourceType resourceType() {
        return ResourceType.MANAGED_DATABASE;
    }

    @Override
    protected ListingEndpoint<RdsBackupRecord> endpoint() {
        return backendApi.rdsBackups();
    }

    @Override
    protected String assetIdField() {
        return "resource_id";
    }
}
