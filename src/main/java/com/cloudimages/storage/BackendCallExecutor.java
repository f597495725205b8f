package com.cloudimages.storage;

import com.cloudimages.config.AppConfig;
import com.cloudimages.exception.CloudImagesException;
import com.cloudimages.exception.ProviderConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs blocking remote storage calls on the storage executor and waits for
 * them at most {@code app.backend-timeout-ms}. Timeouts and transport failures
 * surface as {@link ProviderConnectionException}.
 *
 * Interrupting a timed-out call does not stop every blocking network write;
 * callers that need to undo a write which lands after the timeout pass a
 * late-result handler.
 */
@Component
public class BackendCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackendCallExecutor.class);

    private final ThreadPoolTaskExecutor storageExecutor;
    private final AppConfig appConfig;

    public BackendCallExecutor(@Qualifier("storageExecutor") ThreadPoolTaskExecutor storageExecutor,
            AppConfig appConfig) {
        this.storageExecutor = storageExecutor;
        this.appConfig = appConfig;
    }

    /**
     * Executes {@code call} with the configured timeout.
     *
     * @param operation short description used in logs and error messages, e.g. "upload to provider 4"
     */
    public <T> T call(String operation, Callable<T> call) {
        return call(operation, call, null);
    }

    /**
     * Executes {@code call} with the configured timeout. If the caller gives
     * up on the call but it still succeeds afterwards, its result is handed
     * to {@code lateResultHandler} on the storage executor, so that side
     * effects nobody is waiting for any more can be undone.
     *
     * @param operation         short description used in logs and error messages
     * @param lateResultHandler receives results that arrive after the timeout; may be null
     */
    public <T> T call(String operation, Callable<T> call, Consumer<? super T> lateResultHandler) {
        long timeoutMs = appConfig.getBackendTimeoutMs();
        AtomicReference<CallState> state = new AtomicReference<>(CallState.RUNNING);
        Callable<T> tracked = () -> {
            T result = call.call();
            if (!state.compareAndSet(CallState.RUNNING, CallState.COMPLETED) && lateResultHandler != null) {
                handOffLateResult(operation, result, lateResultHandler);
            }
            return result;
        };

        Future<T> future;
        try {
            future = storageExecutor.submit(tracked);
        } catch (RejectedExecutionException e) {
            throw new ProviderConnectionException("Storage executor is saturated, cannot run " + operation, e);
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!state.compareAndSet(CallState.RUNNING, CallState.ABANDONED)) {
                // completed right at the deadline; the result is about to be returned
                return awaitCompleted(operation, future);
            }
            future.cancel(true);
            log.warn("Remote storage call timed out after {} ms: {}", timeoutMs, operation);
            throw new ProviderConnectionException(
                    "Remote storage did not respond within " + timeoutMs + " ms (" + operation + ")", e);
        } catch (InterruptedException e) {
            state.compareAndSet(CallState.RUNNING, CallState.ABANDONED);
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderConnectionException("Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            throw unwrap(operation, e);
        }
    }

    private <T> T awaitCompleted(String operation, Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderConnectionException("Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            throw unwrap(operation, e);
        }
    }

    private <T> void handOffLateResult(String operation, T result, Consumer<? super T> handler) {
        log.warn("Abandoned remote storage call completed late: {}", operation);
        try {
            // a fresh task, so the handler does not inherit the cancelled call's interrupt
            storageExecutor.execute(() -> {
                try {
                    handler.accept(result);
                } catch (RuntimeException e) {
                    log.error("Cleanup after late completion of {} failed", operation, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Cleanup after late completion of {} could not be scheduled", operation, e);
        }
    }

    private static RuntimeException unwrap(String operation, ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof CloudImagesException) {
            return (CloudImagesException) cause;
        }
        return new ProviderConnectionException(
                "Remote storage call failed (" + operation + "): " + describe(cause), cause);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private enum CallState {
        RUNNING, COMPLETED, ABANDONED
    }
}
