package com.instaclustr.bulkrestore.impl.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a time window search relative to its end offset. {@link #UNSET} searches the whole history.
 */
public enum SearchDirection {
    BEFORE,
    AFTER,
    UNSET;

    @JsonCreator
    public static SearchDirection parse(final String value) {
        if (value == null) {
            return UNSET;
        }
        switch (value.trim().toLowerCase()) {
            case "before":
                return BEFORE;
            case "after":
                return AFTER;
            default:
                return UNSET;
        }
    }

    @JsonValue
    public String toValue() {
        return this == UNSET ? null : name().toLowerCase();
    }
}
