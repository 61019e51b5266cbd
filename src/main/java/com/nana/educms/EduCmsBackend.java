package com.nana.educms;

import com.nana.educms.repository.IdGenerator;
import com.nana.educms.repository.JdbcUnitOfWorkFactory;
import com.nana.educms.repository.UnitOfWork;
import com.nana.educms.service.StudentService;
import com.nana.educms.service.StudentServiceImpl;
import com.nana.educms.service.StudentStatistics;
import com.nana.educms.util.AppConfig;
import com.nana.educms.util.AppLogger;
import com.nana.educms.util.DatabaseManager;
import com.nana.educms.util.RequestExecutor;
import com.nana.educms.util.SampleDataLoader;
import com.nana.educms.util.UnitOfWorkCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

/**
 * EduCmsBackend — Composition Root
 *
 * <p>Wires the backend once at startup:
 * <pre>
 *   AppConfig → DatabaseManager (schema + migrations)
 *             → JdbcUnitOfWorkFactory (one connection and context per request)
 *             → RequestExecutor (worker pool)
 * </pre>
 * and tears it down in reverse on {@link #close()}.
 *
 * <p>Requests are submitted through {@link #submit} or, for student work,
 * {@link #submitStudentRequest}, which hands the callback a
 * {@link StudentService} bound to that request's own unit of work.
 */
public final class EduCmsBackend implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EduCmsBackend.class);

    /** Student work run inside one request. */
    @FunctionalInterface
    public interface StudentCallback<T> {
        T doWithStudents(StudentService studentService) throws Exception;
    }

    private final LocalDateTime startTime = LocalDateTime.now();

    // -----------------------------------------------------------------------
    // DEPENDENCY INSTANCES (composition root)
    // -----------------------------------------------------------------------

    private final AppConfig config;
    private final Clock clock;
    private final DatabaseManager databaseManager;
    private final JdbcUnitOfWorkFactory unitOfWorkFactory;
    private final RequestExecutor requestExecutor;

    public EduCmsBackend(AppConfig config) {
        this(config, Clock.systemUTC(), IdGenerator.random());
    }

    /**
     * Initialises the database and starts the worker pool.
     *
     * @throws DatabaseManager.DatabaseInitException if the schema cannot be
     *         created or migrated
     */
    public EduCmsBackend(AppConfig config, Clock clock, IdGenerator idGenerator) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null.");
        }
        this.config = config;
        this.clock  = clock;

        log.info("Wiring backend dependencies...");
        databaseManager = DatabaseManager.fromConfig(config);
        AppLogger.logStartup(databaseManager.getUrl());
        databaseManager.initialize();

        unitOfWorkFactory = new JdbcUnitOfWorkFactory(databaseManager, clock, idGenerator);
        requestExecutor   = new RequestExecutor(unitOfWorkFactory,
                config.getInt(AppConfig.KEY_EXECUTOR_POOL_SIZE, AppConfig.DEFAULT_POOL_SIZE));
        log.info("Dependencies wired successfully.");

        if (config.getBoolean(AppConfig.KEY_LOAD_SAMPLE_DATA)) {
            loadSampleData();
        }
        AppLogger.logEvent("BACKEND_STARTED", "db=" + databaseManager.getUrl());
    }

    // -----------------------------------------------------------------------
    // REQUESTS
    // -----------------------------------------------------------------------

    public <T> CompletableFuture<T> submit(String operation, UnitOfWorkCallback<T> callback) {
        return requestExecutor.submit(operation, callback);
    }

    public <T> CompletableFuture<T> submitStudentRequest(String operation, StudentCallback<T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback must not be null.");
        }
        return requestExecutor.submit(operation,
                unitOfWork -> callback.doWithStudents(new StudentServiceImpl(unitOfWork, clock)));
    }

    public AppConfig getConfig() {
        return config;
    }

    public DatabaseManager getDatabaseManager() {
        return databaseManager;
    }

    // -----------------------------------------------------------------------
    // LIFECYCLE
    // -----------------------------------------------------------------------

    private void loadSampleData() {
        try (UnitOfWork unitOfWork = unitOfWorkFactory.create()) {
            SampleDataLoader.loadIfEmpty(unitOfWork, clock);
        }
    }

    @Override
    public void close() {
        log.info("Backend close() called - shutting down.");
        AppLogger.logEvent("BACKEND_STOPPING", "");
        requestExecutor.close();
        AppLogger.logShutdown(startTime);
    }

    // -----------------------------------------------------------------------
    // MAIN METHOD
    // -----------------------------------------------------------------------

    /**
     * Starts the backend with the layered configuration, logs the current
     * student statistics and shuts down.
     */
    public static void main(String[] args) throws Exception {
        try (EduCmsBackend backend = new EduCmsBackend(AppConfig.getInstance())) {
            StudentStatistics stats = backend
                    .submitStudentRequest("STUDENT_STATISTICS", StudentService::getStudentStatistics)
                    .get();
            log.info("Current student statistics: {}", stats);
        }
    }
}
