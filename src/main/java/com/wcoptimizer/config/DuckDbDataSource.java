package com.wcoptimizer.config;

import lombok.extern.slf4j.Slf4j;
import org.duckdb.DuckDBConnection;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.jdbc.datasource.AbstractDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Hands out connections that share one DuckDB database instance. Each caller gets
 * its own duplicate of a root connection and closes it when done; the root stays
 * open for the lifetime of the application context. This is what lets an in-memory
 * database be seen by more than one connection.
 */
@Slf4j
public class DuckDbDataSource extends AbstractDataSource implements DisposableBean {

    static final String URL_PREFIX = "jdbc:duckdb:";

    private final String url;
    private DuckDBConnection root;

    public DuckDbDataSource(String url) {
        if (url == null || !url.startsWith(URL_PREFIX)) {
            throw new IllegalArgumentException("Not a DuckDB JDBC url: " + url);
        }
        this.url = url;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return rootConnection().duplicate();
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return getConnection();
    }

    private synchronized DuckDBConnection rootConnection() throws SQLException {
        if (root == null || root.isClosed()) {
            createParentDirectory();
            root = DriverManager.getConnection(url).unwrap(DuckDBConnection.class);
            log.info("DuckDB opened → {}", url);
        }
        return root;
    }

    private void createParentDirectory() {
        String location = url.substring(URL_PREFIX.length());
        int options = location.indexOf('?');
        if (options >= 0) {
            location = location.substring(0, options);
        }
        if (location.isBlank() || location.startsWith(":memory:")) {
            return;
        }
        Path parent = Path.of(location).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create DuckDB directory " + parent, e);
        }
    }

    @Override
    public synchronized void destroy() throws SQLException {
        if (root != null && !root.isClosed()) {
            root.close();
            log.info("DuckDB closed → {}", url);
        }
    }
}
