package io.hivescan.client;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Suspends one logical task without holding a thread.
 * <p>
 * Used for the rate-limit backoff and the poll interval. Tests substitute an implementation
 * that completes immediately and records the requested durations.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Completes after the duration has elapsed, on the {@link CompletableFuture} delayed executor.
     */
    Sleeper DEFAULT = duration -> CompletableFuture.runAsync(() -> { },
            CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS));

    /**
     * @param duration how long to wait
     * @return a future completing once the duration has elapsed
     */
    CompletableFuture<Void> sleep(Duration duration);
}
