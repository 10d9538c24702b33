package com.instaclustr.bulkrestore.impl.filter;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * Sort order of a listing call, serialized as {@code field} for ascending and {@code -field} for descending
 * order.
 */
public final class Sort {

    private final String field;
    private final boolean descending;

    private Sort(final String field, final boolean descending) {
        checkArgument(!isNullOrEmpty(field), "sort field can not be empty");
        this.field = field;
        this.descending = descending;
    }

    public static Sort ascending(final String field) {
        return new Sort(field, false);
    }

    public static Sort descending(final String field) {
        return new Sort(field, true);
    }

    public String getField() {
        return field;
    }

    public boolean isDescending() {
        return descending;
    }

    @JsonValue
    public String toValue() {
        return descending ? "-" + field : field;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Sort sort = (Sort) o;
        return descending == sort.descending && field.equals(sort.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, descending);
    }

    @Override
    public String toString() {
        return toValue();
    }
}
