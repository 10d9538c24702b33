package com.instaclustr.bulkrestore.impl.filter;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder.TimeWindow;
import org.junit.jupiter.api.Test;

import static com.instaclustr.bulkrestore.impl.filter.FilterOperator.GT;
import static com.instaclustr.bulkrestore.impl.filter.FilterOperator.LTE;
import static com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder.START_TIMESTAMP;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TimeWindowFilterBuilderTest {

    private final TimeWindowFilterBuilder builder = new TimeWindowFilterBuilder(Clock.fixed(Instant.parse("2024-03-10T15:30:00Z"), ZoneOffset.UTC));

    @Test
    public void afterWindow() {
        final TimeWindow window = builder.build(SearchWindow.parse("after", "2", "1"));

        assertEquals("2024-03-08T00:00:00Z", window.getFilter().get(START_TIMESTAMP, GT));
        assertEquals("2024-03-09T23:59:59Z", window.getFilter().get(START_TIMESTAMP, LTE));
        assertEquals(START_TIMESTAMP, window.getSort().toValue());
    }

    @Test
    public void beforeWindow() {
        final TimeWindow window = builder.build(SearchWindow.parse("before", "2", "1"));

        assertEquals("2024-03-09T23:59:59Z", window.getFilter().get(START_TIMESTAMP, LTE));
        assertNull(window.getFilter().get(START_TIMESTAMP, GT));
        assertEquals("-" + START_TIMESTAMP, window.getSort().toValue());
    }

    @Test
    public void unknownDirectionHasNoFilter() {
        final TimeWindow window = builder.build(SearchWindow.parse("random", "2", "1"));

        assertTrue(window.getFilter().isEmpty());
        assertEquals(START_TIMESTAMP, window.getSort().toValue());
    }

    @Test
    public void todayEndsAtLastSecond() {
        assertEquals("2024-03-10T23:59:59Z", builder.endOfDay(0));
        assertEquals("2024-03-10T00:00:00Z", builder.startOfDay(0));
    }

    @Test
    public void offsetsHaveToBeNonNegativeIntegers() {
        assertThrows(ValidationException.class, () -> SearchWindow.parse("after", "-1", "0"));
        assertThrows(ValidationException.class, () -> SearchWindow.parse("after", "two", "0"));
        assertThrows(ValidationException.class, () -> SearchWindow.parse("after", null, "0"));
    }
}
