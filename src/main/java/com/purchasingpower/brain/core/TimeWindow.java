package com.purchasingpower.brain.core;

import java.time.Instant;

/**
 * Optional, inclusive time bounds. Either end may be null.
 */
public record TimeWindow(Instant start, Instant end) {

    public static final TimeWindow UNBOUNDED = new TimeWindow(null, null);

    public static TimeWindow of(Instant start, Instant end) {
        if (start == null && end == null) {
            return UNBOUNDED;
        }
        return new TimeWindow(start, end);
    }

    /**
     * Entities without a timestamp are inside every window.
     */
    public boolean contains(Instant timestamp) {
        if (timestamp == null) {
            return true;
        }
        if (start != null && timestamp.isBefore(start)) {
            return false;
        }
        return end == null || !timestamp.isAfter(end);
    }

    /**
     * Stable text form used in cluster identity keys: {@code start|end}, blanks for open ends.
     */
    public String key() {
        return (start == null ? "" : start.toString()) + "|" + (end == null ? "" : end.toString());
    }
}
