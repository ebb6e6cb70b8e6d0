package io.github.yok.dwloader.transform;

import java.util.Map;
import java.util.Optional;

/**
 * Cleanses one bronze row into one silver row.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface RowTransform {

    /**
     * Transforms a row.
     *
     * @param row bronze row keyed by lower-case column name; values are raw strings
     * @return silver row keyed by lower-case column name, or empty to drop the row
     */
    Optional<Map<String, Object>> apply(Map<String, Object> row);
}
