package io.hivescan.client;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.hivescan.client.config.FanOutSettings;
import io.hivescan.client.http.HttpResponse;
import io.hivescan.spec.HivescanClientException;
import io.hivescan.spec.HivescanTooManyRetriesException;
import io.hivescan.spec.HivescanTransportException;
import io.hivescan.util.Assert;
import io.hivescan.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one logical request, retrying it unchanged while the server answers with 429.
 * <p>
 * Each rate-limited response costs one unit of the retry budget and is followed by a fixed
 * backoff before the next attempt. When the budget runs out the call fails with
 * {@link HivescanTooManyRetriesException}. Any other response is decoded once: a decoding
 * failure or an error status is final and never retried, and so is a transport failure.
 * <p>
 * Attempts of one call are strictly sequential. Separate calls share nothing but the
 * transport, so any number of them may run concurrently; the backoff suspends only the call
 * that was rate limited.
 */
public class RetryingRequestExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingRequestExecutor.class);

    private final int retryBudget;
    private final Duration backoff;
    private final Sleeper sleeper;
    private final ResponseDecoder decoder;

    public RetryingRequestExecutor(FanOutSettings settings, Sleeper sleeper) {
        this(settings.getRetryBudget(), settings.getRateLimitBackoff(), sleeper, new ResponseDecoder());
    }

    public RetryingRequestExecutor(int retryBudget, Duration backoff, Sleeper sleeper, ResponseDecoder decoder) {
        this.retryBudget = Assert.checkMinimumParam("retryBudget", 1, retryBudget);
        this.backoff = Assert.checkNotNullParam("backoff", backoff);
        this.sleeper = Assert.checkNotNullParam("sleeper", sleeper);
        this.decoder = Assert.checkNotNullParam("decoder", decoder);
    }

    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<HttpResponse>> request, TypeReference<T> type) {
        return execute(request, Utils.OBJECT_MAPPER.getTypeFactory().constructType(type));
    }

    /**
     * @param request sends the request; invoked once per attempt
     * @param type the type to decode a non-rate-limited response into
     * @param <T> the decoded type
     * @return the decoded value, or a future failed with a {@link HivescanClientException}
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<HttpResponse>> request, JavaType type) {
        Assert.checkNotNullParam("request", request);
        Assert.checkNotNullParam("type", type);
        return attempt(request, retryBudget).thenCompose(response -> {
            try {
                return CompletableFuture.completedFuture(decoder.<T>decode(response, type));
            } catch (HivescanClientException e) {
                return CompletableFuture.failedFuture(e);
            }
        });
    }

    private CompletableFuture<HttpResponse> attempt(Supplier<CompletableFuture<HttpResponse>> request, int remaining) {
        CompletableFuture<HttpResponse> sent;
        try {
            sent = request.get();
            if (sent == null) {
                sent = CompletableFuture.failedFuture(new IllegalStateException("Request returned no future"));
            }
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }

        return sent.handle((response, error) -> {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                return CompletableFuture.<HttpResponse>failedFuture(
                        new HivescanTransportException("Request failed: " + cause.getMessage(), cause));
            }
            if (response == null) {
                return CompletableFuture.<HttpResponse>failedFuture(new HivescanTransportException(
                        "Request failed: no response received", new IllegalStateException("null response")));
            }
            if (!response.rateLimited()) {
                return CompletableFuture.completedFuture(response);
            }

            int left = remaining - 1;
            if (left == 0) {
                LOGGER.warn("Still rate limited after {} attempts, giving up", retryBudget);
                return CompletableFuture.<HttpResponse>failedFuture(new HivescanTooManyRetriesException(retryBudget));
            }
            LOGGER.debug("Rate limited, retrying in {} ({} attempts left)", backoff, left);
            return sleeper.sleep(backoff).thenCompose(v -> attempt(request, left));
        }).thenCompose(next -> next);
    }
}
