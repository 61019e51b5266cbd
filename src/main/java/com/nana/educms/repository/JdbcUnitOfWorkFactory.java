package com.nana.educms.repository;

import com.nana.educms.repository.Repository.RepositoryException;
import com.nana.educms.util.DatabaseManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;

/**
 * Opens each {@link UnitOfWork} on a fresh connection from {@link DatabaseManager}.
 */
public class JdbcUnitOfWorkFactory implements UnitOfWorkFactory {

    private final DatabaseManager databaseManager;
    private final Clock clock;
    private final IdGenerator idGenerator;

    public JdbcUnitOfWorkFactory(DatabaseManager databaseManager) {
        this(databaseManager, Clock.systemUTC(), IdGenerator.random());
    }

    public JdbcUnitOfWorkFactory(DatabaseManager databaseManager, Clock clock, IdGenerator idGenerator) {
        this.databaseManager = Objects.requireNonNull(databaseManager, "databaseManager");
        this.clock           = Objects.requireNonNull(clock, "clock");
        this.idGenerator     = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    @Override
    public UnitOfWork create() {
        Connection connection;
        try {
            connection = databaseManager.openConnection();
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to open a database connection.", ex);
        }
        return new JdbcUnitOfWork(new PersistenceContext(connection, clock, idGenerator));
    }

    /** @return the clock every unit from this factory stamps timestamps with */
    public Clock getClock() {
        return clock;
    }
}
