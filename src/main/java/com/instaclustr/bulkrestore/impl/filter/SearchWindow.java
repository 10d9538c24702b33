package com.instaclustr.bulkrestore.impl.filter;

import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.impl.ValidationException;

import static java.lang.String.format;

/**
 * Validated search window, offsets are whole days counted back from today.
 */
public final class SearchWindow {

    public static final String START_OFFSET_FIELD = "start_search_day_offset";
    public static final String END_OFFSET_FIELD = "end_search_day_offset";

    private final SearchDirection direction;
    private final int startDayOffset;
    private final int endDayOffset;

    public SearchWindow(final SearchDirection direction, final int startDayOffset, final int endDayOffset) {
        this.direction = direction == null ? SearchDirection.UNSET : direction;
        this.startDayOffset = checkOffset(START_OFFSET_FIELD, startDayOffset);
        this.endDayOffset = checkOffset(END_OFFSET_FIELD, endDayOffset);
    }

    /**
     * Parses offsets as they come in input documents.
     *
     * @throws ValidationException when an offset is not an integer or is negative
     */
    public static SearchWindow parse(final String direction, final String startDayOffset, final String endDayOffset) {
        return new SearchWindow(SearchDirection.parse(direction),
                                parseOffset(START_OFFSET_FIELD, startDayOffset),
                                parseOffset(END_OFFSET_FIELD, endDayOffset));
    }

    private static int parseOffset(final String field, final String value) {
        if (value == null) {
            throw new ValidationException(field, format("%s has to be set", field));
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException ex) {
            throw new ValidationException(field, format("%s has to be an integer, it is '%s'", field, value), ex);
        }
    }

    private static int checkOffset(final String field, final int value) {
        if (value < 0) {
            throw new ValidationException(field, format("%s can not be negative, it is %s", field, value));
        }
        return value;
    }

    public SearchDirection getDirection() {
        return direction;
    }

    public int getStartDayOffset() {
        return startDayOffset;
    }

    public int getEndDayOffset() {
        return endDayOffset;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("direction", direction)
            .add("startDayOffset", startDayOffset)
            .add("endDayOffset", endDayOffset)
            .toString();
    }
}
