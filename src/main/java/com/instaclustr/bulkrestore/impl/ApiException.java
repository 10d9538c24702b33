package com.instaclustr.bulkrestore.impl;

import static java.lang.String.format;

/**
 * The backend answered with a non-success status. Reason and raw content are kept as the backend sent them.
 */
public class ApiException extends BulkRestoreException {

    private final int backendStatusCode;
    private final String reason;
    private final String content;

    public ApiException(final int backendStatusCode, final String reason, final String content) {
        super(format("Backend call failed with status %s: %s - %s", backendStatusCode, reason, content));
        this.backendStatusCode = backendStatusCode;
        this.reason = reason;
        this.content = content;
    }

    public int getBackendStatusCode() {
        return backendStatusCode;
    }

    public String getReason() {
        return reason;
    }

    public String getContent() {
        return content;
    }

    @Override
    public int getStatusCode() {
        return 500;
    }
}
