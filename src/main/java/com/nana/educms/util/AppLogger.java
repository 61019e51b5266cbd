package com.nana.educms.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * AppLogger — Logging Utility
 *
 * <p>Per-class logging uses SLF4J directly:
 * <pre>
 *     private static final Logger log = LoggerFactory.getLogger(MyClass.class);
 * </pre>
 * This class adds what goes beyond one class:
 * <ul>
 *   <li>startup/shutdown banners marking where each run begins and ends;</li>
 *   <li>structured business events ({@code [EVENT] NAME | details});</li>
 *   <li>MDC context so every line logged while serving one request carries
 *       the operation name and a request id.</li>
 * </ul>
 *
 * <p>MDC is thread-local. {@link RequestExecutor} sets it on the worker
 * thread at the start of each request and clears it in a {@code finally}
 * block so pooled threads never leak it into the next request.
 */
public final class AppLogger {

    private static final Logger APP_LOG = LoggerFactory.getLogger("com.nana.educms.APP");

    private static final DateTimeFormatter EVENT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key for the id of the request being served. */
    public static final String MDC_REQUEST = "request";

    private static final String APP_NAME = "EduCMS Records Backend";

    private AppLogger() {
        throw new UnsupportedOperationException("AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STARTUP / SHUTDOWN BANNERS
    // -----------------------------------------------------------------------

    /**
     * Logs the startup banner with Java and OS details.
     *
     * @param databaseUrl the JDBC URL the backend is about to use
     */
    public static void logStartup(String databaseUrl) {
        String separator = "=".repeat(60);
        APP_LOG.info(separator);
        APP_LOG.info("  {}", APP_NAME);
        APP_LOG.info("  Starting up — {}", LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Java:     {} ({})",
                System.getProperty("java.version"),
                System.getProperty("java.vendor"));
        APP_LOG.info("  OS:       {} {} ({})",
                System.getProperty("os.name"),
                System.getProperty("os.version"),
                System.getProperty("os.arch"));
        APP_LOG.info("  Database: {}", databaseUrl);
        APP_LOG.info(separator);
    }

    /**
     * Logs the shutdown banner with the run duration.
     *
     * @param startTime when the backend started; null gives a zero duration
     */
    public static void logShutdown(LocalDateTime startTime) {
        String separator = "-".repeat(60);
        long seconds = startTime == null ? 0 : Duration.between(startTime, LocalDateTime.now()).getSeconds();
        APP_LOG.info(separator);
        APP_LOG.info("  {} shutting down — {}", APP_NAME, LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Uptime: {}h {}m {}s", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
        APP_LOG.info(separator);
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Logs a business event: a meaningful state change that should appear
     * regardless of debug level.
     *
     * @param eventName short label, e.g. {@code STUDENT_CREATED}
     * @param details   context, e.g. {@code studentId=STU001}
     */
    public static void logEvent(String eventName, String details) {
        APP_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    public static void logWarningEvent(String eventName, String details) {
        APP_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    public static void logErrorEvent(String eventName, String details, Throwable throwable) {
        APP_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    /**
     * Tags every following log line on this thread with the operation name
     * and a request id. Always pair with {@link #clearRequestContext()} in a
     * {@code finally} block.
     *
     * @return the generated request id
     */
    public static String setRequestContext(String operationName) {
        String requestId = generateRequestId();
        MDC.put(MDC_OPERATION, operationName);
        MDC.put(MDC_REQUEST, requestId);
        return requestId;
    }

    public static void clearRequestContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_REQUEST);
    }

    /** @return a short random id for correlating the log lines of one request */
    public static String generateRequestId() {
        return "REQ-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
