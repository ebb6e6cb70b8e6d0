package io.github.yok.dwloader.db;

import io.github.yok.dwloader.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * {@link ConnectionProvider} backed by {@link DriverManager} and {@code warehouse.connection}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriverManagerConnectionProvider implements ConnectionProvider {

    private final ConnectionConfig connectionConfig;

    @Override
    public Connection open() throws SQLException {
        ConnectionConfig.Entry entry = connectionConfig.getConnection();
        if (StringUtils.isBlank(entry.getUrl())) {
            throw new SQLException("warehouse.connection.url is not configured");
        }
        if (StringUtils.isNotBlank(entry.getDriverClass())) {
            try {
                Class.forName(entry.getDriverClass());
            } catch (ClassNotFoundException e) {
                throw new SQLException("JDBC driver not found: " + entry.getDriverClass(), e);
            }
        }
        log.debug("Opening JDBC connection: {}", entry.getUrl());
        return DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
    }
}
