package io.github.yok.dwloader.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens JDBC connections to the warehouse. Each call returns a new connection owned by the caller.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Opens a new connection.
     *
     * @return open connection in auto-commit mode
     * @throws SQLException if the connection cannot be opened
     */
    Connection open() throws SQLException;
}
