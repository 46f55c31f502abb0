package io.hivescan.client;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import io.hivescan.spec.HivescanClientException;

/**
 * Bridges the asynchronous API to callers that want to block.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
     * {@link CompletableFuture} adds around the original failure.
     *
     * @param throwable the failure as observed on a future
     * @return the original failure
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Waits for the future and rethrows its failure as the {@link HivescanClientException}
     * it was completed with.
     *
     * @param future the future to wait for
     * @param <T> the result type
     * @return the result
     * @throws HivescanClientException if the future failed with a client exception, or the wait was interrupted
     */
    public static <T> T await(CompletableFuture<T> future) throws HivescanClientException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HivescanClientException("Interrupted while waiting for response", e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof HivescanClientException) {
                throw (HivescanClientException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new HivescanClientException(cause);
        }
    }
}
