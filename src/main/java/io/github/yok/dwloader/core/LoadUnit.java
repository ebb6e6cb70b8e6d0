package io.github.yok.dwloader.core;

import java.sql.Connection;

/**
 * One independently committed piece of a run (one bronze table, one silver table, or the gold
 * model).
 *
 * @author Yasuharu.Okawauchi
 */
public interface LoadUnit {

    /**
     * Returns the name recorded in the run ledger.
     *
     * @return unit name
     */
    String name();

    /**
     * Performs the unit's work on a connection whose transaction the caller owns. Implementations
     * must neither commit nor roll back.
     *
     * @param jdbc connection with auto-commit disabled
     * @return row counts
     * @throws Exception any failure; the caller rolls back and records it
     */
    UnitResult execute(Connection jdbc) throws Exception;
}
