package com.instaclustr.bulkrestore.impl;

import static java.lang.String.format;

public class TooManyResultsException extends BulkRestoreException {

    private final int count;
    private final int maxResults;

    public TooManyResultsException(final int count, final int maxResults) {
        super(format("Found %s backup records, more than the allowed maximum of %s. Narrow the search.", count, maxResults));
        this.count = count;
        this.maxResults = maxResults;
    }

    public int getCount() {
        return count;
    }

    public int getMaxResults() {
        return maxResults;
    }

    @Override
    public int getStatusCode() {
        return 413;
    }
}
