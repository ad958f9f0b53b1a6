package strata.core.service.remote;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.port.out.CacheMetrics;

/**
 * Applies the per-call timeout and fail-open handling to remote tier operations.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: fails with {@link RemoteTimeoutException} on timeout,
 *       propagates other failures. Used by health checks, which need to observe failures.</li>
 *   <li>{@link #withTimeoutGraceful} - Fail-soft: empty Optional on timeout or any failure.
 *       Used for reads, where a timeout is the same as a miss.</li>
 *   <li>{@link #withTimeoutFallback} - Fail-open: custom fallback on timeout or any failure.
 *       Used for writes and deletes, which report {@code false}.</li>
 * </ul>
 *
 * <p>Every guarded call is counted while in flight so shutdown can wait for outstanding I/O
 * before the connection is released.
 */
public class RemoteCallGuard {

    private static final Logger LOG = Logger.getLogger(RemoteCallGuard.class);

    /**
     * Notified of each failed or timed out call.
     */
    @FunctionalInterface
    public interface FailureListener {
        void onFailure(String operation, String key, Throwable cause);
    }

    private final Duration timeout;
    private final CacheMetrics metrics;
    private final FailureListener failureListener;
    private final AtomicInteger inFlight = new AtomicInteger();

    public RemoteCallGuard(Duration timeout, CacheMetrics metrics, FailureListener failureListener) {
        this.timeout = timeout;
        this.metrics = metrics == null ? CacheMetrics.noop() : metrics;
        this.failureListener = failureListener == null ? (op, key, cause) -> {} : failureListener;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Apply a timeout that fails the call.
     *
     * @return a Uni that fails with RemoteTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName, Duration limit) {
        return tracked(operation.ifNoItem().after(limit).failWith(() -> {
            LOG.debugv("Remote operation timeout: {0} after {1}", operationName, limit);
            metrics.recordRemoteTimeout(operationName);
            return new RemoteTimeoutException(operationName, limit);
        }));
    }

    /**
     * Apply the timeout and treat timeouts and failures as an empty result.
     */
    public <T> Uni<Optional<T>> withTimeoutGraceful(Uni<Optional<T>> operation, String operationName, String key) {
        return tracked(operation
                .map(result -> result == null ? Optional.<T>empty() : result)
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Remote operation timeout (graceful): {0} key={1} after {2}", operationName, key, timeout);
                    metrics.recordRemoteTimeout(operationName);
                    failureListener.onFailure(operationName, key, new TimeoutException("Timed out after " + timeout));
                    return Optional.empty();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Remote operation failure (graceful): {0} key={1}: {2}", operationName, key, error.getMessage());
                    metrics.recordRemoteFailure(operationName, error.getClass().getSimpleName());
                    failureListener.onFailure(operationName, key, error);
                    return Optional.empty();
                }));
    }

    /**
     * Apply the timeout and substitute a fallback value on timeout or failure.
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, String key, Supplier<T> fallback) {
        return tracked(operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Remote operation timeout (fallback): {0} key={1} after {2}", operationName, key, timeout);
                    metrics.recordRemoteTimeout(operationName);
                    failureListener.onFailure(operationName, key, new TimeoutException("Timed out after " + timeout));
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Remote operation failure (fallback): {0} key={1}: {2}", operationName, key, error.getMessage());
                    metrics.recordRemoteFailure(operationName, error.getClass().getSimpleName());
                    failureListener.onFailure(operationName, key, error);
                    return fallback.get();
                }));
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Wait until no guarded call is in flight.
     *
     * @return true if idle before the deadline
     */
    public boolean awaitIdle(Duration limit) {
        long deadline = System.nanoTime() + limit.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private <T> Uni<T> tracked(Uni<T> guarded) {
        return guarded.onSubscription()
                .invoke(subscription -> inFlight.incrementAndGet())
                .onTermination()
                .invoke(() -> inFlight.decrementAndGet());
    }

    /**
     * A remote call exceeded its timeout.
     */
    public static class RemoteTimeoutException extends RuntimeException {
        private final String operation;

        public RemoteTimeoutException(String operation, Duration timeout) {
            super("Remote operation timeout: " + operation + " after " + timeout);
            this.operation = operation;
        }

        public String getOperation() {
            return operation;
        }
    }
}
