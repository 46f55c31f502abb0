package io.hivescan.client.fanout;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

import io.hivescan.client.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Fetches {

    private static final Logger LOGGER = LoggerFactory.getLogger(Fetches.class);

    private Fetches() {
    }

    /**
     * Starts the fetch for one item. A fetch that throws, returns {@code null} or fails is turned
     * into a failed outcome carrying the placeholder. The returned future only completes
     * exceptionally, with an {@link IllegalStateException}, when the placeholder itself cannot be
     * produced.
     */
    static <W, T> CompletableFuture<FetchOutcome<W, T>> launch(W item, Function<W, CompletableFuture<T>> fetch,
                                                               Supplier<T> placeholder) {
        CompletableFuture<T> started;
        try {
            started = fetch.apply(item);
            if (started == null) {
                started = CompletableFuture.failedFuture(new IllegalStateException("Fetch returned no future"));
            }
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }

        return started.handle((value, error) -> {
            if (error == null && value != null) {
                return FetchOutcome.success(item, value);
            }
            Throwable cause = error == null
                    ? new IllegalStateException("Fetch completed without a value")
                    : Futures.unwrap(error);
            LOGGER.warn("Error fetching {}: {}", item, cause.getMessage(), cause);
            return FetchOutcome.failure(item, placeholderFor(item, placeholder), cause);
        });
    }

    private static <W, T> T placeholderFor(W item, Supplier<T> placeholder) {
        T value;
        try {
            value = placeholder.get();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Placeholder supplier failed for " + item, e);
        }
        if (value == null) {
            throw new IllegalStateException("Placeholder supplier returned null for " + item);
        }
        return value;
    }
}
