package org.urbanscope.datapipeline.api.resources.source;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Search window for {@link ISourceClient#search}.
 */
public sealed interface TimeWindow permits TimeWindow.Recent, TimeWindow.Day, TimeWindow.Page {

    /**
     * Records published within the last {@code days} days.
     */
    record Recent(int days) implements TimeWindow {
        public Recent {
            if (days <= 0) {
                throw new IllegalArgumentException("days must be positive: " + days);
            }
        }
    }

    /**
     * Records published on a single calendar day.
     */
    record Day(LocalDate date) implements TimeWindow {
        public Day {
            Objects.requireNonNull(date, "date cannot be null");
        }
    }

    /**
     * A page of the unrestricted result set, used for backfill crawls.
     *
     * @param start zero-based offset into the result set
     */
    record Page(int start) implements TimeWindow {
        public Page {
            if (start < 0) {
                throw new IllegalArgumentException("start must not be negative: " + start);
            }
        }
    }

    static TimeWindow recent(int days) {
        return new Recent(days);
    }

    static TimeWindow day(LocalDate date) {
        return new Day(date);
    }

    static TimeWindow page(int start) {
        return new Page(start);
    }

    /**
     * Short tag for report and debug file names.
     */
    default String tag() {
        if (this instanceof Recent r) {
            return "recent" + r.days() + "d";
        }
        if (this instanceof Day d) {
            return d.date().toString();
        }
        return "crawl" + ((Page) this).start();
    }
}
