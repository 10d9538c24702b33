package com.instaclustr.bulkrestore.impl.backend;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

public final class ListingResponse<T> {

    private final boolean ok;
    private final int statusCode;
    private final String reason;
    private final String content;
    private final List<T> items;
    private final int totalCount;
    private final int totalPages;

    public ListingResponse(final boolean ok,
                           final int statusCode,
                           final String reason,
                           final String content,
                           final List<T> items,
                           final int totalCount,
                           final int totalPages) {
        this.ok = ok;
        this.statusCode = statusCode;
        this.reason = reason;
        this.content = content;
        this.items = items == null ? ImmutableList.of() : ImmutableList.copyOf(items);
        this.totalCount = totalCount;
        this.totalPages = totalPages;
    }

    public static <T> ListingResponse<T> page(final List<T> items, final int totalCount, final int totalPages) {
        return new ListingResponse<>(true, 200, "OK", null, items, totalCount, totalPages);
    }

    public static <T> ListingResponse<T> failure(final int statusCode, final String reason, final String content) {
        return new ListingResponse<>(false, statusCode, reason, content, ImmutableList.of(), 0, 0);
    }

    public boolean isOk() {
        return ok;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReason() {
        return reason;
    }

    public String getContent() {
        return content;
    }

    public List<T> getItems() {
        return items;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public int getTotalPages() {
        return totalPages;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("ok", ok)
            .add("statusCode", statusCode)
            .add("reason", reason)
            .add("totalCount", totalCount)
            .add("totalPages", totalPages)
            .add("items", items.size())
            .toString();
    }
}
