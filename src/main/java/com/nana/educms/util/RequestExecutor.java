package com.nana.educms.util;

import com.nana.educms.repository.UnitOfWork;
import com.nana.educms.repository.UnitOfWorkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RequestExecutor — Request-Scoped Background Execution
 *
 * <p>Runs each request on a fixed pool of named daemon threads. Every request:
 * <ol>
 *   <li>gets its own MDC context ({@code operation}, {@code request});</li>
 *   <li>opens its own {@link UnitOfWork} from the factory, so no
 *       persistence context is ever shared between requests;</li>
 *   <li>closes that unit on every exit path: success, failure or
 *       cancellation.</li>
 * </ol>
 *
 * <p>CANCELLATION:
 * Cancelling the returned {@link CompletableFuture} interrupts the worker
 * thread. The persistence context notices the interrupt at its next store
 * access and throws {@link CancellationException}; anything staged but not
 * yet saved is discarded when the unit closes. A request cancelled before
 * it starts never opens a unit at all.
 */
public final class RequestExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private static final int SHUTDOWN_TIMEOUT_SECS = 5;

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final ExecutorService pool;

    public RequestExecutor(UnitOfWorkFactory unitOfWorkFactory, int poolSize) {
        if (unitOfWorkFactory == null) {
            throw new IllegalArgumentException("unitOfWorkFactory must not be null.");
        }
        this.unitOfWorkFactory = unitOfWorkFactory;
        int threads = Math.max(1, poolSize);
        this.pool = Executors.newFixedThreadPool(threads, new NamedDaemonThreadFactory("educms-worker"));
        log.info("RequestExecutor initialised with {} worker threads.", threads);
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Submits one request.
     *
     * @param operation label for logs, e.g. {@code "CREATE_STUDENT"}
     * @param callback  the work to run inside the request's unit of work
     * @return a future completed with the callback's result, or exceptionally
     *         with whatever it threw
     */
    public <T> CompletableFuture<T> submit(String operation, UnitOfWorkCallback<T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback must not be null.");
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> running = pool.submit(() -> execute(operation, callback, result));
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                running.cancel(true);
            }
        });
        log.debug("Request submitted: {}", operation);
        return result;
    }

    private <T> void execute(String operation, UnitOfWorkCallback<T> callback, CompletableFuture<T> result) {
        if (result.isDone()) {
            log.debug("Request {} cancelled before it started.", operation);
            return;
        }
        String requestId = AppLogger.setRequestContext(operation);
        try (UnitOfWork unitOfWork = unitOfWorkFactory.create()) {
            result.complete(callback.doInUnitOfWork(unitOfWork));
        } catch (CancellationException ex) {
            AppLogger.logWarningEvent("REQUEST_CANCELLED", "operation=" + operation + ", request=" + requestId);
            result.completeExceptionally(ex);
        } catch (Exception ex) {
            AppLogger.logErrorEvent("REQUEST_FAILED", "operation=" + operation + ", request=" + requestId, ex);
            result.completeExceptionally(ex);
        } catch (Error err) {
            result.completeExceptionally(err);
            throw err;
        } finally {
            AppLogger.clearRequestContext();
            // pooled threads must not carry a cancellation into the next request
            Thread.interrupted();
        }
    }

    // -----------------------------------------------------------------------
    // SHUTDOWN
    // -----------------------------------------------------------------------

    /**
     * Stops accepting requests, waits up to five seconds for running ones and
     * then interrupts whatever is left.
     */
    @Override
    public void close() {
        log.info("RequestExecutor shutdown initiated.");
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECS, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in {}s; forcing shutdown.", SHUTDOWN_TIMEOUT_SECS);
                pool.shutdownNow();
            } else {
                log.debug("Worker pool terminated gracefully.");
            }
        } catch (InterruptedException ex) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            log.warn("Worker pool shutdown interrupted.");
        }
    }

    public boolean isShutdown() {
        return pool.isShutdown();
    }

    // -----------------------------------------------------------------------
    // INNER CLASSES
    // -----------------------------------------------------------------------

    /**
     * Names threads {@code educms-worker-1}, {@code educms-worker-2}, ... so
     * log lines and thread dumps show which pool they come from. Daemon
     * threads never keep the JVM alive on their own.
     */
    private static final class NamedDaemonThreadFactory implements ThreadFactory {

        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        NamedDaemonThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            log.debug("Thread created: {}", t.getName());
            return t;
        }
    }
}
