package com.instaclustr.bulkrestore.impl.filter;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.google.inject.Inject;

/**
 * Turns a {@link SearchWindow} into a filter over {@code start_timestamp} and the matching sort order.
 * <p>
 * {@code after} selects backups taken after midnight of the start day and up to the last second of the end
 * day, oldest first. {@code before} has no lower bound and lists the newest first. Without a direction
 * nothing is filtered.
 */
public class TimeWindowFilterBuilder {

    public static final String START_TIMESTAMP = "start_timestamp";

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final Clock clock;

    @Inject
    public TimeWindowFilterBuilder(final Clock clock) {
        this.clock = clock;
    }

    public TimeWindow build(final SearchWindow window) {
        final String end = endOfDay(window.getEndDayOffset());
        final String start = startOfDay(window.getStartDayOffset());

        switch (window.getDirection()) {
            case AFTER:
                return new TimeWindow(FilterExpression.builder()
                                          .gt(START_TIMESTAMP, start)
                                          .lte(START_TIMESTAMP, end)
                                          .build(),
                                      Sort.ascending(START_TIMESTAMP));
            case BEFORE:
                return new TimeWindow(FilterExpression.builder().lte(START_TIMESTAMP, end).build(),
                                      Sort.descending(START_TIMESTAMP));
            default:
                return new TimeWindow(FilterExpression.empty(), Sort.ascending(START_TIMESTAMP));
        }
    }

    String endOfDay(final int daysAgo) {
        return daysAgo(daysAgo).atTime(LocalTime.of(23, 59, 59)).format(TIMESTAMP_FORMAT);
    }

    String startOfDay(final int daysAgo) {
        return daysAgo(daysAgo).atStartOfDay().format(TIMESTAMP_FORMAT);
    }

    private LocalDate daysAgo(final int days) {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(days);
    }

    public static final class TimeWindow {

        private final FilterExpression filter;
        private final Sort sort;

        public TimeWindow(final FilterExpression filter, final Sort sort) {
            this.filter = filter;
            this.sort = sort;
        }

        public FilterExpression getFilter() {
            return filter;
        }

        public Sort getSort() {
            return sort;
        }
    }
}
