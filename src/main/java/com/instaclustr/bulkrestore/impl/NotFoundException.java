package com.instaclustr.bulkrestore.impl;

public class NotFoundException extends BulkRestoreException {

    public NotFoundException(final String message) {
        super(message);
    }

    @Override
    public int getStatusCode() {
        return 402;
    }
}
