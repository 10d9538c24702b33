package com.instaclustr.bulkrestore.impl.list;

import java.util.ArrayList;
import java.util.List;

import com.instaclustr.bulkrestore.impl.ApiException;
import com.instaclustr.bulkrestore.impl.backend.ListingEndpoint;
import com.instaclustr.bulkrestore.impl.backend.ListingResponse;
import com.instaclustr.bulkrestore.impl.filter.FilterExpression;
import com.instaclustr.bulkrestore.impl.filter.Sort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains every page of a listing endpoint. Items are returned in the order the backend returned them.
 */
public final class PaginatedFilterFetcher {

    private static final Logger logger = LoggerFactory.getLogger(PaginatedFilterFetcher.class);

    private PaginatedFilterFetcher() {
    }

    public static <T> List<T> fetchAll(final ListingEndpoint<T> endpoint, final FilterExpression filter) {
        return fetchAll(endpoint, filter, null);
    }

    /**
     * @throws ApiException when any page is answered with a non-success status
     */
    public static <T> List<T> fetchAll(final ListingEndpoint<T> endpoint, final FilterExpression filter, final Sort sort) {
        final FilterExpression effectiveFilter = filter == null ? FilterExpression.empty() : filter;
        final List<T> items = new ArrayList<>();

        int start = 1;

        while (true) {
            final ListingResponse<T> response = endpoint.list(effectiveFilter, sort, start);

            if (!response.isOk()) {
                throw new ApiException(response.getStatusCode(), response.getReason(), response.getContent());
            }

            if (response.getTotalCount() == 0) {
                break;
            }

            items.addAll(response.getItems());

            if (response.getTotalPages() <= start) {
                break;
            }

            start += 1;
        }

        logger.debug("Fetched {} items in {} pages with filter {}", items.size(), start, effectiveFilter);

        return items;
    }
}
