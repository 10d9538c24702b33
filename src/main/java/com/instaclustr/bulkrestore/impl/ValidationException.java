package com.instaclustr.bulkrestore.impl;

/**
 * Malformed or missing input, detected before any backend call.
 */
public class ValidationException extends BulkRestoreException {

    private final String field;

    public ValidationException(final String message) {
        this(null, message);
    }

    public ValidationException(final String field, final String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(final String field, final String message, final Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * @return name of the offending field, null when the failure is not tied to a single field
     */
    public String getField() {
        return field;
    }

    @Override
    public int getStatusCode() {
        return 400;
    }
}
