package com.instaclustr.bulkrestore.impl;

/**
 * Root of the failures raised while discovering, resolving, submitting or polling a restore. Each subclass
 * carries the status code the per-asset outcome reports for it.
 */
public abstract class BulkRestoreException extends RuntimeException {

    public BulkRestoreException(final String message) {
        super(message);
    }

    public BulkRestoreException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public abstract int getStatusCode();
}
