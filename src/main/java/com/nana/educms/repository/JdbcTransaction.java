package com.nana.educms.repository;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Explicit transaction handle over one connection.
 *
 * <p>Opening the handle switches auto-commit off. {@link #close()} rolls back
 * whatever was neither committed nor rolled back, then switches auto-commit
 * back on.
 */
final class JdbcTransaction implements AutoCloseable {

    private final Connection connection;
    private boolean completed;
    private boolean closed;

    JdbcTransaction(Connection connection) throws SQLException {
        this.connection = connection;
        connection.setAutoCommit(false);
    }

    void commit() throws SQLException {
        connection.commit();
        completed = true;
    }

    void rollback() throws SQLException {
        connection.rollback();
        completed = true;
    }

    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!completed) {
                connection.rollback();
            }
        } finally {
            connection.setAutoCommit(true);
        }
    }
}
