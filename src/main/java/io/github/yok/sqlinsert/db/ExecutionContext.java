package io.github.yok.sqlinsert.db;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Cancellation token threaded through the prepare and execute steps of an insert.
 *
 * <p>
 * The context does not enforce anything itself. Executors read {@link #getTimeout()} to configure
 * their statements, check {@link #throwIfCancelled()} before each step, and register a callback
 * with {@link #onCancel(Runnable)} that aborts the running statement. {@link #cancel()} may be
 * called from any thread; every registered callback runs at most once.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ExecutionContext {

    // Query timeout, null when none
    private final Duration timeout;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final List<Runnable> cancelCallbacks = new CopyOnWriteArrayList<>();

    private ExecutionContext(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Creates a context without timeout.
     *
     * @return new context
     */
    public static ExecutionContext create() {
        return new ExecutionContext(null);
    }

    /**
     * Creates a context with a query timeout.
     *
     * @param timeout positive timeout
     * @return new context
     * @throws IllegalArgumentException if {@code timeout} is zero or negative
     */
    public static ExecutionContext withTimeout(Duration timeout) {
        Preconditions.checkNotNull(timeout, "timeout must not be null");
        Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(),
                "timeout must be positive: %s", timeout);
        return new ExecutionContext(timeout);
    }

    /**
     * Returns the query timeout.
     *
     * @return timeout, or empty when none was set
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * Returns whether {@link #cancel()} has been called.
     *
     * @return {@code true} once cancelled
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Cancels the context and runs the registered callbacks. Later calls have no effect.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        log.debug("Execution context cancelled. callbacks={}", cancelCallbacks.size());
        // Whoever removes a callback runs it; see onCancel
        for (Runnable callback : cancelCallbacks) {
            if (cancelCallbacks.remove(callback)) {
                callback.run();
            }
        }
    }

    /**
     * Registers a callback that runs when the context is cancelled. If the context is already
     * cancelled, the callback runs immediately.
     *
     * @param callback cancel action
     * @return registration that removes the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        Preconditions.checkNotNull(callback, "callback must not be null");
        cancelCallbacks.add(callback);
        if (cancelled.get() && cancelCallbacks.remove(callback)) {
            callback.run();
        }
        return () -> cancelCallbacks.remove(callback);
    }

    /**
     * Fails when the context has been cancelled.
     *
     * @throws ExecutionCancelledException if cancelled
     */
    public void throwIfCancelled() throws ExecutionCancelledException {
        if (cancelled.get()) {
            throw new ExecutionCancelledException("Insert execution was cancelled");
        }
    }

    /**
     * Handle of a registered cancel callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        /**
         * Removes the callback.
         */
        @Override
        void close();
    }
}
