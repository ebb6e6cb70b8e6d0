package io.github.yok.dwloader.temporal;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One version of a slowly-changing dimension member, valid from {@code startDate} through
 * {@code endDate} inclusive. A {@code null} end date means the version is current.
 *
 * @param <T> payload carried with the version (attributes or a surrogate key)
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class DimensionVersion<T> {

    // Business key shared by all versions of a member
    String businessKey;

    // Secondary monotonic field ordering versions that start on the same day
    Long sequence;

    LocalDate startDate;

    @With
    LocalDate endDate;

    T payload;

    /**
     * Returns whether the version covers a day.
     *
     * @param day day to test
     * @return {@code true} when {@code startDate <= day} and the end is open or {@code day <= endDate}
     */
    public boolean covers(LocalDate day) {
        return !day.isBefore(startDate) && (endDate == null || !day.isAfter(endDate));
    }

    /**
     * Returns whether the interval contains no day at all ({@code endDate < startDate}).
     *
     * @return {@code true} for an empty interval
     */
    public boolean isEmpty() {
        return endDate != null && endDate.isBefore(startDate);
    }
}
