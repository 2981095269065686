package com.fleetmanager.analytics.model;

import com.fleetmanager.analytics.exception.InvalidWindowException;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Half-open time window [start, end). Equal bounds describe an empty window.
 */
@Value
public class Period {

    LocalDateTime start;
    LocalDateTime end;

    private Period(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @throws InvalidWindowException if either bound is missing or start is after end
     */
    public static Period of(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new InvalidWindowException("Period bounds are required. Received: start=" + start + ", end=" + end);
        }
        if (start.isAfter(end)) {
            throw new InvalidWindowException(
                    "Period start must not be after end. Received: start=" + start + ", end=" + end);
        }
        return new Period(start, end);
    }

    public static Period ofYear(int year) {
        return new Period(LocalDate.of(year, 1, 1).atStartOfDay(), LocalDate.of(year + 1, 1, 1).atStartOfDay());
    }

    public boolean contains(LocalDateTime timestamp) {
        return timestamp != null && !timestamp.isBefore(start) && timestamp.isBefore(end);
    }
}
