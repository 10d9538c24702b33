package com.instaclustr.bulkrestore.impl;

public class AuthException extends BulkRestoreException {

    public AuthException(final String message) {
        super(message);
    }

    public AuthException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getStatusCode() {
        return 401;
    }
}
