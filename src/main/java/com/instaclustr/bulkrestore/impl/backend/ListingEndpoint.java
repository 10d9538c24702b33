package com.instaclustr.bulkrestore.impl.backend;

import com.instaclustr.bulkrestore.impl.filter.FilterExpression;
import com.instaclustr.bulkrestore.impl.filter.Sort;

/**
 * Cursor paginated listing of one backend collection. Pages are numbered from 1.
 *
 * @param <T> item of the collection
 */
@FunctionalInterface
public interface ListingEndpoint<T> {

    /**
     * @param filter conditions items have to satisfy, never null, possibly empty
     * @param sort   order of items, null for the backend's default order
     * @param start  page to return
     */
    ListingResponse<T> list(final FilterExpression filter, final Sort sort, final int start);
}
