package com.instaclustr.bulkrestore.impl.list;

import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.backend.ListingEndpoint;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder;
import com.instaclustr.bulkrestore.impl.record.EbsBackupRecord;

public class EbsBackupLister extends AbstractBackupLister<EbsBackupRecord> {

    private final BackendApi backendApi;

    @Inject
    public EbsBackupLister(final BackendApi backendApi, final TimeWindowFilterBuilder timeWindowFilterBuilder) {
        super(timeWindowFilterBuilder);
        this.backendApi = backendApi;
    }

    @Override
    protected ResourceType resourceType() {
        return ResourceType.BLOCK_VOLUME;
    }

    @Override
    protected ListingEndpoint<EbsBackupRecord> endpoint() {
        return backendApi.ebsBackups();
    }

    @Override
    protected String assetIdField() {
        return "volume_id";
    }
}
