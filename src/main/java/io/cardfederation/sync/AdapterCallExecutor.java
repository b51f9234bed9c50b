package io.cardfederation.sync;

import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.exceptions.FederationException;
import io.cardfederation.exceptions.OperationCancelledException;
import io.cardfederation.tasks.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs adapter calls on a worker pool with a hard time budget, honouring cancellation.
 */
@Slf4j
public class AdapterCallExecutor {

    private final ExecutorService executor;
    private final Duration timeout;

    public AdapterCallExecutor(ExecutorService executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Run {@code call} and wait at most the configured timeout.
     *
     * @throws AdapterCallException when the call fails or times out
     * @throws OperationCancelledException when {@code token} is cancelled first
     */
    public <T> T call(PlatformId platform, String action, Callable<T> call, CancellationToken token) {
        token.throwIfCancelled(action + " on " + platform);

        Future<T> future = executor.submit(call);
        Runnable unregister = token.onCancel(() -> future.cancel(true));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Platform: {}] {} timed out after {}ms", platform, action, timeout.toMillis());
            throw new AdapterCallException(platform, FailureKind.TIMEOUT,
                    action + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (CancellationException e) {
            throw new OperationCancelledException(action + " on " + platform + " was cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(action + " on " + platform + " was interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FederationException) {
                throw (FederationException) cause;
            }
            throw new AdapterCallException(platform, FailureKind.UNEXPECTED,
                    action + " failed: " + cause.getMessage(), cause);
        } finally {
            unregister.run();
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
