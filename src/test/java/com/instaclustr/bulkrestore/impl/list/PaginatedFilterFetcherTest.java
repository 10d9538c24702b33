package com.instaclustr.bulkrestore.impl.list;

import java.util.List;

import com.instaclustr.bulkrestore.impl.ApiException;
import com.instaclustr.bulkrestore.impl.backend.FakeEndpoint;
import com.instaclustr.bulkrestore.impl.backend.ListingResponse;
import com.instaclustr.bulkrestore.impl.filter.FilterExpression;
import com.instaclustr.bulkrestore.impl.filter.Sort;
import org.junit.jupiter.api.Test;

import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PaginatedFilterFetcherTest {

    @Test
    public void drainsAllPagesInOrder() {
        final FakeEndpoint<String> endpoint = FakeEndpoint.of(2, "a", "b", "c", "d", "e");
        final FilterExpression filter = FilterExpression.eq("volume_id", "vol-1");
        final Sort sort = Sort.descending("start_timestamp");

        final List<String> items = PaginatedFilterFetcher.fetchAll(endpoint, filter, sort);

        assertEquals(asList("a", "b", "c", "d", "e"), items);
        assertEquals(3, endpoint.calls.size());

        for (int i = 0; i < endpoint.calls.size(); i++) {
            assertEquals(i + 1, endpoint.calls.get(i).start);
            assertSame(filter, endpoint.calls.get(i).filter);
            assertSame(sort, endpoint.calls.get(i).sort);
        }
    }

    @Test
    public void stopsOnEmptyCollection() {
        final FakeEndpoint<String> endpoint = new FakeEndpoint<>(10);

        assertTrue(PaginatedFilterFetcher.fetchAll(endpoint, null).isEmpty());
        assertEquals(1, endpoint.calls.size());
        assertTrue(endpoint.calls.get(0).filter.isEmpty());
    }

    @Test
    public void singlePageIsReadOnce() {
        final FakeEndpoint<String> endpoint = FakeEndpoint.of(10, "a", "b");

        assertEquals(asList("a", "b"), PaginatedFilterFetcher.fetchAll(endpoint, FilterExpression.empty()));
        assertEquals(1, endpoint.calls.size());
    }

    @Test
    public void failedPageRaisesApiException() {
        final FakeEndpoint<String> endpoint = FakeEndpoint.of(10, "a")
            .failWith(ListingResponse.failure(503, "Service Unavailable", "try later"));

        final ApiException ex = assertThrows(ApiException.class, () -> PaginatedFilterFetcher.fetchAll(endpoint, FilterExpression.empty()));

        assertEquals(503, ex.getBackendStatusCode());
        assertEquals("Service Unavailable", ex.getReason());
        assertEquals("try later", ex.getContent());
        assertEquals(500, ex.getStatusCode());
    }
}
