package com.nana.educms;

import com.nana.educms.repository.IdGenerator;
import com.nana.educms.repository.JdbcUnitOfWorkFactory;
import com.nana.educms.util.DatabaseManager;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds an initialised SQLite database inside a test's temporary directory.
 */
public final class TestDatabase {

    private TestDatabase() {
    }

    public static DatabaseManager create(Path dir) {
        DatabaseManager manager = new DatabaseManager(
                "jdbc:sqlite:" + dir.resolve("educms-test.db").toAbsolutePath(), 5000);
        manager.initialize();
        return manager;
    }

    public static JdbcUnitOfWorkFactory factory(Path dir, Clock clock) {
        return new JdbcUnitOfWorkFactory(create(dir), clock, IdGenerator.random());
    }
}
