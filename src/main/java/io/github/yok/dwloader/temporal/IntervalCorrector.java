package io.github.yok.dwloader.temporal;

import io.github.yok.dwloader.core.IntegrityException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Repairs the validity intervals of a slowly-changing dimension.
 *
 * <p>
 * Versions are grouped by business key (groups keep their first-appearance order) and ordered by
 * start date, then by sequence. A version whose end date is earlier than its own start date gets
 * the day before the next version's start, or an open end when it is the last version of its key.
 * Valid end dates are kept as they are.
 * </p>
 *
 * <p>
 * <strong>Rejected as {@link IntegrityException}:</strong>
 * </p>
 * <ul>
 * <li>a version without start date;</li>
 * <li>two versions of a key starting on the same day without distinct sequences;</li>
 * <li>overlapping versions of a key after correction (including an open version that is not the
 * last one).</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IntervalCorrector {

    /**
     * Corrects the intervals.
     *
     * @param <T> payload type
     * @param versions versions of any number of keys
     * @return corrected versions, grouped by key and ordered within each key
     * @throws IntegrityException if the versions cannot form non-overlapping intervals
     */
    public <T> List<DimensionVersion<T>> correct(List<DimensionVersion<T>> versions) {
        Map<String, List<DimensionVersion<T>>> byKey = new LinkedHashMap<>();
        for (DimensionVersion<T> version : versions) {
            if (version.getStartDate() == null) {
                throw new IntegrityException("Version of " + version.getBusinessKey()
                        + " (sequence " + version.getSequence() + ") has no start date");
            }
            byKey.computeIfAbsent(version.getBusinessKey(), k -> new ArrayList<>()).add(version);
        }

        List<DimensionVersion<T>> corrected = new ArrayList<>(versions.size());
        int repaired = 0;
        for (Map.Entry<String, List<DimensionVersion<T>>> group : byKey.entrySet()) {
            List<DimensionVersion<T>> ordered = new ArrayList<>(group.getValue());
            ordered.sort(Comparator.comparing(DimensionVersion<T>::getStartDate).thenComparing(
                    DimensionVersion<T>::getSequence,
                    Comparator.nullsFirst(Comparator.naturalOrder())));
            checkTies(group.getKey(), ordered);

            List<DimensionVersion<T>> fixed = new ArrayList<>(ordered.size());
            for (int i = 0; i < ordered.size(); i++) {
                DimensionVersion<T> version = ordered.get(i);
                if (version.isEmpty()) {
                    LocalDate end = i + 1 < ordered.size()
                            ? ordered.get(i + 1).getStartDate().minusDays(1)
                            : null;
                    version = version.withEndDate(end);
                    repaired++;
                }
                fixed.add(version);
            }
            checkOverlaps(group.getKey(), fixed);
            corrected.addAll(fixed);
        }
        log.debug("Interval correction: keys={} versions={} repaired={}", byKey.size(),
                corrected.size(), repaired);
        return corrected;
    }

    private static <T> void checkTies(String key, List<DimensionVersion<T>> ordered) {
        for (int i = 1; i < ordered.size(); i++) {
            DimensionVersion<T> previous = ordered.get(i - 1);
            DimensionVersion<T> current = ordered.get(i);
            if (previous.getStartDate().equals(current.getStartDate())
                    && (previous.getSequence() == null
                            || Objects.equals(previous.getSequence(), current.getSequence()))) {
                throw new IntegrityException("Versions of " + key + " share start date "
                        + current.getStartDate() + " without distinct sequences");
            }
        }
    }

    private static <T> void checkOverlaps(String key, List<DimensionVersion<T>> fixed) {
        DimensionVersion<T> last = null;
        for (DimensionVersion<T> version : fixed) {
            // A version superseded on its own start day covers no day
            if (version.isEmpty()) {
                continue;
            }
            if (last != null && (last.getEndDate() == null
                    || !last.getEndDate().isBefore(version.getStartDate()))) {
                throw new IntegrityException("Versions of " + key + " overlap: ["
                        + last.getStartDate() + ", " + last.getEndDate() + "] and ["
                        + version.getStartDate() + ", " + version.getEndDate() + "]");
            }
            last = version;
        }
    }
}
