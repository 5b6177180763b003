package com.nodeguardian.engine;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs calls to external systems (metrics backend, Kubernetes API, notification transports)
 * on the {@code ioExecutor} and waits at most {@code nodeguardian.engine.external-call-timeout}.
 *
 * <p>A call that times out, is rejected by the pool or throws is reported through the
 * caller-supplied {@code onFailure} mapper so each caller raises its own error category.
 */
@Component
public class ExternalCallExecutor {

    private final Executor ioExecutor;
    private final Duration timeout;

    @Autowired
    public ExternalCallExecutor(@Qualifier("ioExecutor") Executor ioExecutor, GuardianEngineConfig guardianEngineConfig) {
        this(ioExecutor, guardianEngineConfig.getExternalCallTimeout());
    }

    public ExternalCallExecutor(Executor ioExecutor, Duration timeout) {
        this.ioExecutor = ioExecutor;
        this.timeout = timeout;
    }

    public <T> T call(Callable<T> callable, Function<Throwable, ? extends RuntimeException> onFailure) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> {
                        try {
                            return callable.call();
                        } catch (RuntimeException e) {
                            throw e;
                        } catch (Exception e) {
                            throw new CompletionException(e);
                        }
                    },
                    ioExecutor);
        } catch (RejectedExecutionException e) {
            throw onFailure.apply(e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw onFailure.apply(new TimeoutException("No response within " + timeout));
        } catch (ExecutionException e) {
            throw onFailure.apply(unwrap(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw onFailure.apply(e);
        }
    }

    public void run(Runnable runnable, Function<Throwable, ? extends RuntimeException> onFailure) {
        call(
                () -> {
                    runnable.run();
                    return null;
                },
                onFailure);
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
