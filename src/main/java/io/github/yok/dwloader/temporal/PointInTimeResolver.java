package io.github.yok.dwloader.temporal;

import io.github.yok.dwloader.core.IntegrityException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves a business key and an event date to the dimension version valid on that date.
 *
 * <p>
 * A version matches when {@code startDate <= date} and its end is open or {@code date <= endDate}.
 * No match (unknown key, date before the first version, or no date at all) resolves to empty. More
 * than one match is an {@link IntegrityException}.
 * </p>
 *
 * @param <T> payload type
 * @author Yasuharu.Okawauchi
 */
public class PointInTimeResolver<T> {

    private final Map<String, List<DimensionVersion<T>>> byKey = new HashMap<>();

    /**
     * Creates a resolver over corrected versions.
     *
     * @param versions versions as returned by {@link IntervalCorrector#correct(List)}
     */
    public PointInTimeResolver(List<DimensionVersion<T>> versions) {
        for (DimensionVersion<T> version : versions) {
            byKey.computeIfAbsent(version.getBusinessKey(), k -> new ArrayList<>()).add(version);
        }
    }

    /**
     * Resolves a fact reference.
     *
     * @param businessKey referenced key
     * @param eventDate event date of the fact
     * @return matching version, or empty when none matches
     * @throws IntegrityException if more than one version matches
     */
    public Optional<DimensionVersion<T>> resolve(String businessKey, LocalDate eventDate) {
        if (businessKey == null || eventDate == null) {
            return Optional.empty();
        }
        List<DimensionVersion<T>> matches = byKey.getOrDefault(businessKey, List.of()).stream()
                .filter(v -> v.covers(eventDate)).collect(Collectors.toList());
        if (matches.size() > 1) {
            throw new IntegrityException(matches.size() + " versions of " + businessKey
                    + " are valid on " + eventDate);
        }
        return matches.stream().findFirst();
    }
}
