package io.hivescan.client.fanout;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

import io.hivescan.client.Futures;
import io.hivescan.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one fetch per item with at most {@code concurrencyLimit} fetches in flight.
 * <p>
 * The per-item fetch may itself retry on rate limiting, so the cap keeps a large input from
 * multiplying the pressure on the server. As soon as a fetch completes the next queued item is
 * started. Outcomes are collected in completion order; each input element appears exactly once.
 * <p>
 * After every completion the {@link ProgressSink} is told how many items are done. The result
 * list and the progress counter are only touched while holding the aggregation's lock, never by
 * the fetches themselves.
 *
 * @param <W> the work item type
 * @param <T> the fetched value type
 */
public class BoundedFanOut<W, T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoundedFanOut.class);

    private final int concurrencyLimit;
    private final Supplier<T> placeholder;
    private final ProgressSink progressSink;

    public BoundedFanOut(int concurrencyLimit, Supplier<T> placeholder) {
        this(concurrencyLimit, placeholder, ProgressSink.NOOP);
    }

    /**
     * @param concurrencyLimit the maximum number of fetches in flight, at least 1
     * @param placeholder supplies the value recorded for an item whose fetch failed
     * @param progressSink notified after each completion
     * @throws IllegalArgumentException if {@code concurrencyLimit} is smaller than 1
     */
    public BoundedFanOut(int concurrencyLimit, Supplier<T> placeholder, ProgressSink progressSink) {
        this.concurrencyLimit = Assert.checkMinimumParam("concurrencyLimit", 1, concurrencyLimit);
        this.placeholder = Assert.checkNotNullParam("placeholder", placeholder);
        this.progressSink = Assert.checkNotNullParam("progressSink", progressSink);
    }

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    /**
     * Fetches every item, never more than {@code concurrencyLimit} at once.
     *
     * @param items the work items; duplicates are fetched once per occurrence
     * @param fetch starts the fetch for one item
     * @return one outcome per item, in completion order; completes exceptionally only if the
     *         placeholder supplier fails
     */
    public CompletableFuture<List<FetchOutcome<W, T>>> aggregate(Collection<W> items,
                                                                 Function<W, CompletableFuture<T>> fetch) {
        Assert.checkNotNullParam("items", items);
        Assert.checkNotNullParam("fetch", fetch);
        return new Run(List.copyOf(items), fetch).start();
    }

    private final class Run {
        private final Object lock = new Object();
        private final Iterator<W> pending;
        private final int total;
        private final Function<W, CompletableFuture<T>> fetch;
        private final List<FetchOutcome<W, T>> outcomes;
        private final CompletableFuture<List<FetchOutcome<W, T>>> result = new CompletableFuture<>();
        private int completed;

        Run(List<W> items, Function<W, CompletableFuture<T>> fetch) {
            this.pending = items.iterator();
            this.total = items.size();
            this.fetch = fetch;
            this.outcomes = new ArrayList<>(total);
        }

        CompletableFuture<List<FetchOutcome<W, T>>> start() {
            if (total == 0) {
                result.complete(List.of());
                return result;
            }
            int lanes = Math.min(concurrencyLimit, total);
            LOGGER.debug("Fetching {} items with {} concurrent lanes", total, lanes);
            for (int i = 0; i < lanes; i++) {
                runLane();
            }
            return result;
        }

        /**
         * A lane owns at most one in-flight fetch. Fetches that are already done are drained in a
         * loop so a run of synchronous completions does not grow the stack.
         */
        private void runLane() {
            while (true) {
                W item = nextItem();
                if (item == null) {
                    return;
                }
                CompletableFuture<FetchOutcome<W, T>> outcome = Fetches.launch(item, fetch, placeholder);
                if (outcome.isDone() && !outcome.isCompletedExceptionally()) {
                    record(outcome.join());
                    continue;
                }
                outcome.whenComplete((o, error) -> {
                    if (error != null) {
                        abort(error);
                    } else {
                        record(o);
                        runLane();
                    }
                });
                return;
            }
        }

        private @Nullable W nextItem() {
            synchronized (lock) {
                return pending.hasNext() ? pending.next() : null;
            }
        }

        private void abort(Throwable error) {
            Throwable cause = Futures.unwrap(error);
            LOGGER.error("Aborting fan-out of {} items: {}", total, cause.getMessage(), cause);
            result.completeExceptionally(cause);
        }

        private void record(FetchOutcome<W, T> outcome) {
            boolean finished;
            synchronized (lock) {
                outcomes.add(outcome);
                completed++;
                finished = completed == total;
                try {
                    progressSink.report(completed, total);
                } catch (RuntimeException e) {
                    LOGGER.warn("Progress sink failed at {}/{}: {}", completed, total, e.getMessage(), e);
                }
            }
            if (finished) {
                result.complete(List.copyOf(outcomes));
            }
        }
    }
}
