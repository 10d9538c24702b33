package com.instaclustr.bulkrestore.impl.list;

import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.backend.ListingEndpoint;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder;
import com.instaclustr.bulkrestore.impl.record.Ec2BackupRecord;

public class Ec2BackupLister extends AbstractBackupLister<Ec2BackupRecord> {

    private final BackendApi backendApi;

    @Inject
    public Ec2BackupLister(final BackendApi backendApi, final TimeWindowFilterBuilder timeWindowFilterBuilder) {
        super(timeWindowFilterBuilder);
        this.backendApi = backendApi;
    }

    @Override
    protected ResourceType resourceType() {
        return ResourceType.COMPUTE_INSTANCE;
    }

    @Override
    protected ListingEndpoint<Ec2BackupRecord> endpoint() {
        return backendApi.ec2Backups();
    }

    @Override
    protected String assetIdField() {
        return "instance_id";
    }
}
