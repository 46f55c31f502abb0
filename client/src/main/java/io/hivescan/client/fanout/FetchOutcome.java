package io.hivescan.client.fanout;

import io.hivescan.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The result of fetching one work item during a fan-out.
 *
 * @param item the work item the fetch was issued for
 * @param value the fetched value, or the aggregation's placeholder when the fetch failed
 * @param failure why the fetch failed, {@code null} on success
 * @param <W> the work item type
 * @param <T> the fetched value type
 */
public record FetchOutcome<W, T>(W item, T value, @Nullable Throwable failure) {

    public FetchOutcome {
        Assert.checkNotNullParam("item", item);
        Assert.checkNotNullParam("value", value);
    }

    public static <W, T> FetchOutcome<W, T> success(W item, T value) {
        return new FetchOutcome<>(item, value, null);
    }

    public static <W, T> FetchOutcome<W, T> failure(W item, T placeholder, Throwable failure) {
        return new FetchOutcome<>(item, placeholder, Assert.checkNotNullParam("failure", failure));
    }

    public boolean success() {
        return failure == null;
    }
}
